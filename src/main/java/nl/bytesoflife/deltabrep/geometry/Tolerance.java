package nl.bytesoflife.deltabrep.geometry;

/**
 * Shared numeric tolerances for geometric comparisons.
 */
public final class Tolerance {

    /** Default distance tolerance for coincidence and zero-length tests. */
    public static final double EPSILON = 1e-6;

    private Tolerance() {
    }

    public static boolean isZero(double value) {
        return Math.abs(value) < EPSILON;
    }

    public static boolean approxEquals(double a, double b) {
        return Math.abs(a - b) < EPSILON;
    }
}
