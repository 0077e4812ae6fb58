package nl.bytesoflife.deltabrep.geometry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class Vector3Test {

    @Test
    void crossOfAxesFollowsRightHandRule() {
        assertEquals(Vector3.Z, Vector3.X.cross(Vector3.Y));
        assertEquals(Vector3.X, Vector3.Y.cross(Vector3.Z));
        assertEquals(Vector3.Y, Vector3.Z.cross(Vector3.X));
        assertEquals(Vector3.NEG_Z, Vector3.Y.cross(Vector3.X));
    }

    @Test
    void normalizeProducesUnitLength() {
        Vector3 v = new Vector3(3, 4, 12);
        Vector3 n = v.normalize().orElseThrow();
        assertEquals(1.0, n.length(), 1e-12);
        assertEquals(13.0, v.length(), 1e-12);
    }

    @Test
    void normalizeOfZeroVectorIsEmpty() {
        assertTrue(Vector3.ZERO.normalize().isEmpty());
        assertTrue(new Vector3(1e-9, 0, 0).normalize().isEmpty());
        assertEquals(Vector3.Z, Vector3.ZERO.normalizeOrZ());
    }

    @Test
    void dotAndAngle() {
        assertEquals(0.0, Vector3.X.dot(Vector3.Y));
        assertEquals(32.0, new Vector3(1, 2, 3).dot(new Vector3(4, 5, 6)));
        assertEquals(Math.PI / 2, Vector3.X.angle(Vector3.Y), 1e-12);
        assertEquals(Math.PI, Vector3.X.angle(Vector3.NEG_X), 1e-12);
        assertEquals(0.0, Vector3.X.angle(Vector3.ZERO));
    }

    @Test
    void projectOntoAxis() {
        Vector3 p = new Vector3(2, 3, 4).projectOnto(new Vector3(0, 0, 5));
        assertTrue(p.approxEquals(new Vector3(0, 0, 4), 1e-12));
        assertEquals(Vector3.ZERO, Vector3.X.projectOnto(Vector3.ZERO));
    }

    @Test
    void arithmetic() {
        Vector3 a = new Vector3(1, 2, 3);
        Vector3 b = new Vector3(-1, 0, 2);
        assertEquals(new Vector3(0, 2, 5), a.add(b));
        assertEquals(new Vector3(2, 2, 1), a.subtract(b));
        assertEquals(new Vector3(2, 4, 6), a.scale(2));
        assertEquals(new Vector3(-1, -2, -3), a.negate());
    }
}
