package nl.bytesoflife.deltabrep.sketch;

import java.util.Optional;

/**
 * Small 2D predicates used by the sketcher.
 */
public final class SketchMath {

    /** Below this determinant the three points are treated as collinear. */
    static final double COLLINEAR_EPSILON = 1e-8;

    private SketchMath() {
    }

    /**
     * Center of the circle through three points, or empty when they are collinear.
     */
    public static Optional<Point2> circumcenter(Point2 p1, Point2 p2, Point2 p3) {
        double x1 = p1.x(), y1 = p1.y();
        double x2 = p2.x(), y2 = p2.y();
        double x3 = p3.x(), y3 = p3.y();

        double d = 2 * (x1 * (y2 - y3) + x2 * (y3 - y1) + x3 * (y1 - y2));
        if (Math.abs(d) < COLLINEAR_EPSILON) {
            return Optional.empty();
        }

        double s1 = x1 * x1 + y1 * y1;
        double s2 = x2 * x2 + y2 * y2;
        double s3 = x3 * x3 + y3 * y3;

        double cx = (s1 * (y2 - y3) + s2 * (y3 - y1) + s3 * (y1 - y2)) / d;
        double cy = (s1 * (x3 - x2) + s2 * (x1 - x3) + s3 * (x2 - x1)) / d;
        return Optional.of(new Point2(cx, cy));
    }

    /**
     * Twice the signed area of triangle (a, b, c). Positive when a -> b -> c
     * turns counter-clockwise.
     */
    public static double orient2d(Point2 a, Point2 b, Point2 c) {
        return (b.x() - a.x()) * (c.y() - a.y()) - (b.y() - a.y()) * (c.x() - a.x());
    }
}
