package nl.bytesoflife.deltabrep.geometry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundingBoxTest {

    @Test
    void emptyIsIdentityForUnion() {
        BoundingBox box = BoundingBox.of(0, 0, 0, 1, 2, 3);
        assertTrue(BoundingBox.EMPTY.isEmpty());
        assertEquals(box, BoundingBox.EMPTY.union(box));
        assertEquals(box, box.union(BoundingBox.EMPTY));
        assertTrue(BoundingBox.EMPTY.union(BoundingBox.EMPTY).isEmpty());
    }

    @Test
    void emptyHasZeroSizeAndCenter() {
        assertEquals(Vector3.ZERO, BoundingBox.EMPTY.size());
        assertEquals(Point3.ORIGIN, BoundingBox.EMPTY.center());
        assertEquals(0.0, BoundingBox.EMPTY.diagonal());
    }

    @Test
    void fromPointsCoversAllPoints() {
        BoundingBox box = BoundingBox.fromPoints(List.of(
                new Point3(1, -2, 0), new Point3(-3, 4, 5), new Point3(0, 0, -1)));
        assertEquals(new Point3(-3, -2, -1), box.getMin());
        assertEquals(new Point3(1, 4, 5), box.getMax());
        assertEquals(4.0, box.getWidth());
        assertEquals(6.0, box.getLength());
        assertEquals(6.0, box.getHeight());
        assertTrue(BoundingBox.fromPoints(List.of()).isEmpty());
    }

    @Test
    void unionOfDisjointBoxes() {
        BoundingBox a = BoundingBox.of(0, 0, 0, 1, 1, 1);
        BoundingBox b = BoundingBox.of(2, 3, 4, 5, 6, 7);
        BoundingBox u = a.union(b);
        assertEquals(new Point3(0, 0, 0), u.getMin());
        assertEquals(new Point3(5, 6, 7), u.getMax());
        assertFalse(a.intersects(b));
        assertTrue(u.intersects(a));
    }

    @Test
    void containsAndCenter() {
        BoundingBox box = BoundingBox.of(-1, -1, -1, 1, 1, 3);
        assertEquals(new Point3(0, 0, 1), box.center());
        assertTrue(box.contains(new Point3(1, 1, 3)));
        assertFalse(box.contains(new Point3(0, 0, 3.5)));
        assertFalse(BoundingBox.EMPTY.contains(Point3.ORIGIN));
    }

    @Test
    void expandByMargin() {
        BoundingBox box = BoundingBox.of(0, 0, 0, 1, 1, 1).expand(0.5);
        assertEquals(new Point3(-0.5, -0.5, -0.5), box.getMin());
        assertEquals(new Point3(1.5, 1.5, 1.5), box.getMax());
        assertTrue(BoundingBox.EMPTY.expand(1).isEmpty());
    }
}
