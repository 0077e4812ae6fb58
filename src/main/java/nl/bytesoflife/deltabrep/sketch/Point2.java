package nl.bytesoflife.deltabrep.sketch;

/**
 * A point in sketch (plane-local) coordinates.
 */
public record Point2(double x, double y) {

    public double distance(Point2 other) {
        return Math.sqrt(distanceSquared(other));
    }

    public double distanceSquared(Point2 other) {
        double dx = x - other.x;
        double dy = y - other.y;
        return dx * dx + dy * dy;
    }

    public Point2 lerp(Point2 other, double t) {
        return new Point2(x + (other.x - x) * t, y + (other.y - y) * t);
    }

    public Point2 midpoint(Point2 other) {
        return lerp(other, 0.5);
    }
}
