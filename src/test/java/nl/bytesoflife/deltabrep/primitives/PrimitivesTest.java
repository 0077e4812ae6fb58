package nl.bytesoflife.deltabrep.primitives;

import nl.bytesoflife.deltabrep.geometry.BoundingBox;
import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.geometry.Vector3;
import nl.bytesoflife.deltabrep.topology.EdgeId;
import nl.bytesoflife.deltabrep.topology.Face;
import nl.bytesoflife.deltabrep.topology.LoopEntry;
import nl.bytesoflife.deltabrep.topology.Shell;
import nl.bytesoflife.deltabrep.topology.ShellId;
import nl.bytesoflife.deltabrep.topology.Solid;
import nl.bytesoflife.deltabrep.topology.SurfaceType;
import nl.bytesoflife.deltabrep.topology.Vertex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrimitivesTest {

    @Test
    void boxCounts() {
        Solid box = Primitives.makeBox(2, 3, 4);
        assertEquals(8, box.vertexCount());
        assertEquals(12, box.edgeCount());
        assertEquals(6, box.faceCount());
        assertEquals(1, box.shellCount());
        assertTrue(box.getShells().get(0).isClosed());
        assertTrue(box.isValid());
        assertEquals(2, box.eulerCharacteristic());
        assertEachEdgeUsedTwiceInOppositeDirections(box);
    }

    @Test
    void boxIsCenteredWithRequestedSize() {
        Solid box = Primitives.makeBoxAt(new Point3(10, 20, 30), 2, 3, 4);
        BoundingBox bounds = box.boundingBox();
        assertTrue(bounds.getMin().approxEquals(new Point3(9, 18.5, 28)));
        assertTrue(bounds.getMax().approxEquals(new Point3(11, 21.5, 32)));
    }

    @Test
    void boxBottomFaceWalksItsEdgesForward() {
        Solid box = Primitives.makeBox(1, 1, 1);
        Face bottom = box.getFaces().get(0);
        assertEquals(new SurfaceType.Planar(Vector3.NEG_Z), bottom.getSurface());
        assertTrue(bottom.getOuterLoop().getEntries().stream().allMatch(LoopEntry::forward));
        Face top = box.getFaces().get(1);
        assertEquals(new SurfaceType.Planar(Vector3.Z), top.getSurface());
        assertTrue(top.getOuterLoop().getEntries().stream().allMatch(LoopEntry::forward));
    }

    @Test
    void everyFaceIsBackLinkedToTheShell() {
        for (Solid solid : allPrimitives()) {
            Shell shell = solid.getShells().get(0);
            assertEquals(solid.faceCount(), shell.getFaces().size());
            for (Face face : solid.getFaces()) {
                assertEquals(new ShellId(0), face.getShell().orElseThrow());
                assertTrue(shell.getFaces().contains(face.getId()));
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 4, 12, 32})
    void cylinderCounts(int segments) {
        Solid cylinder = Primitives.makeCylinder(1.5, 4, segments);
        assertEquals(2 * segments, cylinder.vertexCount());
        assertEquals(3 * segments, cylinder.edgeCount());
        assertEquals(segments + 2, cylinder.faceCount());
        assertTrue(cylinder.isValid());
        assertEachEdgeUsedTwiceInOppositeDirections(cylinder);
    }

    @Test
    void cylinderSideNormalsPointOutward() {
        Solid cylinder = Primitives.makeCylinder(1, 2, 8);
        for (Face face : cylinder.getFaces().subList(2, cylinder.faceCount())) {
            Vector3 normal = ((SurfaceType.Planar) face.getSurface()).normal();
            assertEquals(1.0, normal.length(), 1e-9);
            assertEquals(0.0, normal.z(), 1e-12);
            Point3 onFace = cylinder.point(face.boundaryVertices(cylinder).get(0)).orElseThrow();
            assertTrue(normal.dot(onFace.toVector()) > 0);
        }
    }

    @Test
    void cylinderVerticesLieOnTheRadius() {
        Solid cylinder = Primitives.makeCylinderAt(new Point3(1, 1, 0), 2, 6, 9);
        for (Vertex v : cylinder.getVertices()) {
            Point3 p = v.getPoint();
            assertEquals(2.0, Math.hypot(p.x() - 1, p.y() - 1), 1e-9);
            assertEquals(3.0, Math.abs(p.z()), 1e-9);
        }
    }

    @Test
    void segmentCountsAreClamped() {
        assertEquals(6, Primitives.makeCylinder(1, 1, 0).vertexCount());
        assertEquals(6, Primitives.makeCylinder(1, 1, -5).vertexCount());
        assertEquals(4, Primitives.makeCone(1, 1, 2).vertexCount());
        // u clamps to 4, v clamps to 2: both poles plus one ring
        assertEquals(6, Primitives.makeSphere(1, 1, 1).vertexCount());
        assertTrue(Primitives.makeSphere(1, 0, 0).isValid());
    }

    @ParameterizedTest
    @CsvSource({"4, 2", "8, 4", "12, 7", "16, 16"})
    void sphereCounts(int u, int v) {
        Solid sphere = Primitives.makeSphere(2, u, v);
        assertEquals(2 + (v - 1) * u, sphere.vertexCount());
        assertEquals(u * (2 * v - 1), sphere.edgeCount());
        assertEquals(u * v, sphere.faceCount());
        assertEquals(2, sphere.eulerCharacteristic());
        assertTrue(sphere.isValid());
        assertEachEdgeUsedTwiceInOppositeDirections(sphere);
    }

    @Test
    void sphereVerticesLieOnTheSurface() {
        Point3 center = new Point3(-1, 2, 5);
        Solid sphere = Primitives.makeSphereAt(center, 3, 10, 5);
        for (Vertex v : sphere.getVertices()) {
            assertEquals(3.0, v.getPoint().distance(center), 1e-9);
        }
        for (Face face : sphere.getFaces()) {
            assertEquals(new SurfaceType.Spherical(center, 3), face.getSurface());
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 5, 24})
    void coneCounts(int segments) {
        Solid cone = Primitives.makeCone(1, 2, segments);
        assertEquals(segments + 1, cone.vertexCount());
        assertEquals(2 * segments, cone.edgeCount());
        assertEquals(segments + 1, cone.faceCount());
        assertTrue(cone.isValid());
        assertEachEdgeUsedTwiceInOppositeDirections(cone);
    }

    @Test
    void coneApexIsFirstVertex() {
        Solid cone = Primitives.makeConeAt(new Point3(0, 0, 1), 2, 3, 6);
        assertEquals(new Point3(0, 0, 4), cone.getVertices().get(0).getPoint());
        SurfaceType.Conical slant = (SurfaceType.Conical) cone.getFaces().get(1).getSurface();
        assertEquals(Math.atan(2.0 / 3.0), slant.halfAngle(), 1e-12);
        assertTrue(slant.normalAt(new Point3(2, 0, 1)).z() > 0);
        assertTrue(slant.normalAt(new Point3(2, 0, 1)).x() > 0);
    }

    @Test
    void generatorsAreDeterministic() {
        Solid a = Primitives.makeSphere(1, 6, 4);
        Solid b = Primitives.makeSphere(1, 6, 4);
        for (int i = 0; i < a.vertexCount(); i++) {
            assertEquals(a.getVertices().get(i).getPoint(), b.getVertices().get(i).getPoint());
        }
        for (int i = 0; i < a.faceCount(); i++) {
            assertEquals(a.getFaces().get(i).getOuterLoop().getEntries(),
                    b.getFaces().get(i).getOuterLoop().getEntries());
        }
    }

    private static List<Solid> allPrimitives() {
        return List.of(
                Primitives.makeBox(1, 2, 3),
                Primitives.makeCylinder(1, 2, 6),
                Primitives.makeSphere(1, 6, 4),
                Primitives.makeCone(1, 2, 5));
    }

    private static void assertEachEdgeUsedTwiceInOppositeDirections(Solid solid) {
        Map<EdgeId, int[]> uses = new HashMap<>();
        for (Face face : solid.getFaces()) {
            for (LoopEntry entry : face.getOuterLoop().getEntries()) {
                int[] counts = uses.computeIfAbsent(entry.edge(), e -> new int[2]);
                counts[entry.forward() ? 0 : 1]++;
            }
        }
        assertEquals(solid.edgeCount(), uses.size(), "every edge should appear in some loop");
        uses.forEach((edge, counts) -> {
            assertEquals(1, counts[0], edge + " forward uses");
            assertEquals(1, counts[1], edge + " reversed uses");
        });
    }
}
