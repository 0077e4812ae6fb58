package nl.bytesoflife.deltabrep.geometry;

/**
 * A position in 3D space.
 */
public record Point3(double x, double y, double z) {

    public static final Point3 ORIGIN = new Point3(0, 0, 0);

    public double distance(Point3 other) {
        return Math.sqrt(distanceSquared(other));
    }

    public double distanceSquared(Point3 other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return dx * dx + dy * dy + dz * dz;
    }

    public boolean approxEquals(Point3 other, double tolerance) {
        return Math.abs(x - other.x) < tolerance
                && Math.abs(y - other.y) < tolerance
                && Math.abs(z - other.z) < tolerance;
    }

    public boolean approxEquals(Point3 other) {
        return approxEquals(other, Tolerance.EPSILON);
    }

    public Point3 lerp(Point3 other, double t) {
        return new Point3(
                x + (other.x - x) * t,
                y + (other.y - y) * t,
                z + (other.z - z) * t);
    }

    public Point3 midpoint(Point3 other) {
        return lerp(other, 0.5);
    }

    public Point3 add(Vector3 v) {
        return new Point3(x + v.x(), y + v.y(), z + v.z());
    }

    /**
     * Vector from {@code other} to this point.
     */
    public Vector3 subtract(Point3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    public Vector3 toVector() {
        return new Vector3(x, y, z);
    }
}
