package nl.bytesoflife.deltabrep.geometry;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable axis-aligned bounding box.
 *
 * {@link #EMPTY} has inverted infinite bounds so that it is the identity for
 * {@link #union(BoundingBox)} and {@link #expandByPoint(Point3)}. Size and
 * center of an empty box are zero.
 */
public final class BoundingBox {

    public static final BoundingBox EMPTY = new BoundingBox(
            new Point3(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY),
            new Point3(Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY));

    private final Point3 min;
    private final Point3 max;

    public BoundingBox(Point3 min, Point3 max) {
        this.min = Objects.requireNonNull(min, "min");
        this.max = Objects.requireNonNull(max, "max");
    }

    public static BoundingBox of(double minX, double minY, double minZ,
                                 double maxX, double maxY, double maxZ) {
        return new BoundingBox(new Point3(minX, minY, minZ), new Point3(maxX, maxY, maxZ));
    }

    public static BoundingBox fromPoints(Collection<Point3> points) {
        BoundingBox bbox = EMPTY;
        for (Point3 p : points) {
            bbox = bbox.expandByPoint(p);
        }
        return bbox;
    }

    public Point3 getMin() {
        return min;
    }

    public Point3 getMax() {
        return max;
    }

    public boolean isEmpty() {
        return min.x() > max.x() || min.y() > max.y() || min.z() > max.z();
    }

    public Vector3 size() {
        if (isEmpty()) {
            return Vector3.ZERO;
        }
        return max.subtract(min);
    }

    /** Extent along X. */
    public double getWidth() {
        return size().x();
    }

    /** Extent along Y. */
    public double getLength() {
        return size().y();
    }

    /** Extent along Z. */
    public double getHeight() {
        return size().z();
    }

    public Point3 center() {
        if (isEmpty()) {
            return Point3.ORIGIN;
        }
        return min.midpoint(max);
    }

    public double diagonal() {
        return size().length();
    }

    public BoundingBox expandByPoint(Point3 p) {
        return new BoundingBox(
                new Point3(Math.min(min.x(), p.x()), Math.min(min.y(), p.y()), Math.min(min.z(), p.z())),
                new Point3(Math.max(max.x(), p.x()), Math.max(max.y(), p.y()), Math.max(max.z(), p.z())));
    }

    /**
     * Smallest box containing both boxes. Also known as "extend".
     */
    public BoundingBox union(BoundingBox other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        return expandByPoint(other.min).expandByPoint(other.max);
    }

    public boolean contains(Point3 p) {
        return p.x() >= min.x() && p.x() <= max.x()
                && p.y() >= min.y() && p.y() <= max.y()
                && p.z() >= min.z() && p.z() <= max.z();
    }

    public boolean intersects(BoundingBox other) {
        if (isEmpty() || other.isEmpty()) return false;
        return min.x() <= other.max.x() && max.x() >= other.min.x()
                && min.y() <= other.max.y() && max.y() >= other.min.y()
                && min.z() <= other.max.z() && max.z() >= other.min.z();
    }

    public BoundingBox expand(double margin) {
        if (isEmpty()) return this;
        return new BoundingBox(
                new Point3(min.x() - margin, min.y() - margin, min.z() - margin),
                new Point3(max.x() + margin, max.y() + margin, max.z() + margin));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox other)) return false;
        return min.equals(other.min) && max.equals(other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "BoundingBox[EMPTY]";
        }
        return String.format(Locale.US, "BoundingBox[(%.4f, %.4f, %.4f) -> (%.4f, %.4f, %.4f)]",
                min.x(), min.y(), min.z(), max.x(), max.y(), max.z());
    }
}
