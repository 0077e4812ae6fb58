package nl.bytesoflife.deltabrep.sketch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SketchMathTest {

    @Test
    void circumcenterOfRightTriangle() {
        Point2 c = SketchMath.circumcenter(new Point2(0, 0), new Point2(2, 0), new Point2(0, 2)).orElseThrow();
        assertEquals(1.0, c.x(), 1e-5);
        assertEquals(1.0, c.y(), 1e-5);
    }

    @Test
    void circumcenterIsEquidistant() {
        Point2 a = new Point2(-3, 1);
        Point2 b = new Point2(4, 2.5);
        Point2 c = new Point2(0.5, -6);
        Point2 center = SketchMath.circumcenter(a, b, c).orElseThrow();
        double r = center.distance(a);
        assertEquals(r, center.distance(b), 1e-9);
        assertEquals(r, center.distance(c), 1e-9);
    }

    @Test
    void circumcenterOfCollinearPointsIsEmpty() {
        assertTrue(SketchMath.circumcenter(new Point2(0, 0), new Point2(1, 1), new Point2(2, 2)).isEmpty());
        assertTrue(SketchMath.circumcenter(new Point2(0, 0), new Point2(0, 0), new Point2(5, 3)).isEmpty());
    }

    @Test
    void orient2dSignFollowsTurnDirection() {
        Point2 a = new Point2(0, 0);
        Point2 b = new Point2(1, 0);
        Point2 c = new Point2(1, 1);
        assertTrue(SketchMath.orient2d(a, b, c) > 0);
        assertTrue(SketchMath.orient2d(a, c, b) < 0);
        assertEquals(1.0, SketchMath.orient2d(a, b, c), 1e-12);
        assertEquals(0.0, SketchMath.orient2d(a, b, new Point2(5, 0)));
    }
}
