package nl.bytesoflife.deltabrep.geometry;

import java.util.Optional;

/**
 * A free direction/displacement in 3D space.
 */
public record Vector3(double x, double y, double z) {

    public static final Vector3 ZERO = new Vector3(0, 0, 0);
    public static final Vector3 X = new Vector3(1, 0, 0);
    public static final Vector3 Y = new Vector3(0, 1, 0);
    public static final Vector3 Z = new Vector3(0, 0, 1);
    public static final Vector3 NEG_X = new Vector3(-1, 0, 0);
    public static final Vector3 NEG_Y = new Vector3(0, -1, 0);
    public static final Vector3 NEG_Z = new Vector3(0, 0, -1);

    public double length() {
        return Math.sqrt(lengthSquared());
    }

    public double lengthSquared() {
        return x * x + y * y + z * z;
    }

    /**
     * Unit vector in the same direction, or empty when the length is below tolerance.
     */
    public Optional<Vector3> normalize() {
        double len = length();
        if (len < Tolerance.EPSILON) {
            return Optional.empty();
        }
        return Optional.of(new Vector3(x / len, y / len, z / len));
    }

    public Vector3 normalizeOrZ() {
        return normalize().orElse(Z);
    }

    public double dot(Vector3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public Vector3 cross(Vector3 other) {
        return new Vector3(
                y * other.z - z * other.y,
                z * other.x - x * other.z,
                x * other.y - y * other.x);
    }

    /**
     * Angle in radians between this vector and another, 0 if either is degenerate.
     */
    public double angle(Vector3 other) {
        double denom = length() * other.length();
        if (denom < Tolerance.EPSILON) {
            return 0;
        }
        double cos = Math.max(-1, Math.min(1, dot(other) / denom));
        return Math.acos(cos);
    }

    public Vector3 projectOnto(Vector3 other) {
        double lenSq = other.lengthSquared();
        if (lenSq < Tolerance.EPSILON * Tolerance.EPSILON) {
            return ZERO;
        }
        return other.scale(dot(other) / lenSq);
    }

    public Vector3 add(Vector3 other) {
        return new Vector3(x + other.x, y + other.y, z + other.z);
    }

    public Vector3 subtract(Vector3 other) {
        return new Vector3(x - other.x, y - other.y, z - other.z);
    }

    public Vector3 scale(double factor) {
        return new Vector3(x * factor, y * factor, z * factor);
    }

    public Vector3 negate() {
        return new Vector3(-x, -y, -z);
    }

    public boolean approxEquals(Vector3 other, double tolerance) {
        return Math.abs(x - other.x) < tolerance
                && Math.abs(y - other.y) < tolerance
                && Math.abs(z - other.z) < tolerance;
    }
}
