package nl.bytesoflife.deltabrep.sketch;

import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.geometry.Vector3;
import nl.bytesoflife.deltabrep.primitives.Primitives;
import nl.bytesoflife.deltabrep.topology.EdgeId;
import nl.bytesoflife.deltabrep.topology.Face;
import nl.bytesoflife.deltabrep.topology.FaceId;
import nl.bytesoflife.deltabrep.topology.Loop;
import nl.bytesoflife.deltabrep.topology.Solid;
import nl.bytesoflife.deltabrep.topology.SurfaceType;
import nl.bytesoflife.deltabrep.topology.VertexId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SketchCoordinateFrameTest {

    private static final List<Point2> SAMPLES = List.of(
            new Point2(0, 0), new Point2(1, 0), new Point2(-3.5, 2.25), new Point2(1e3, -7e2));

    @Test
    void standardPlanesMapAsDocumented() {
        Point2 p = new Point2(2, 3);
        assertEquals(new Point3(2, 3, 0), SketchPlane.Standard.XY.frame().to3d(p));
        assertEquals(new Point3(0, 2, 3), SketchPlane.Standard.YZ.frame().to3d(p));
        assertEquals(new Point3(2, 0, 3), SketchPlane.Standard.XZ.frame().to3d(p));
    }

    @Test
    void standardFramesAreRightHanded() {
        for (SketchPlane.Standard plane : SketchPlane.Standard.values()) {
            SketchCoordinateFrame f = plane.frame();
            assertTrue(f.getUAxis().cross(f.getVAxis()).approxEquals(f.getNormal(), 1e-12), plane.name());
        }
    }

    @Test
    void roundTripThroughArbitraryFrames() {
        List<Vector3> normals = List.of(
                Vector3.Z, Vector3.NEG_X, new Vector3(1, 1, 1), new Vector3(0.2, -0.9, 0.1), new Vector3(0, 3, 4));
        Point3 origin = new Point3(5, -2, 7.5);
        for (Vector3 normal : normals) {
            SketchCoordinateFrame frame = SketchCoordinateFrame.fromOriginNormal(origin, normal).orElseThrow();
            for (Point2 p : SAMPLES) {
                Point2 back = frame.from3d(frame.to3d(p));
                assertEquals(p.x(), back.x(), 1e-5);
                assertEquals(p.y(), back.y(), 1e-5);
            }
        }
    }

    @Test
    void fromOriginNormalBuildsOrthonormalBasis() {
        SketchCoordinateFrame frame = SketchCoordinateFrame
                .fromOriginNormal(Point3.ORIGIN, new Vector3(0, 3, 4)).orElseThrow();
        Vector3 n = frame.getNormal();
        Vector3 u = frame.getUAxis();
        Vector3 v = frame.getVAxis();

        assertTrue(n.approxEquals(new Vector3(0, 0.6, 0.8), 1e-12));
        assertEquals(1.0, u.length(), 1e-12);
        assertEquals(1.0, v.length(), 1e-12);
        assertEquals(0.0, u.dot(n), 1e-12);
        assertEquals(0.0, v.dot(n), 1e-12);
        assertEquals(0.0, u.dot(v), 1e-12);
        assertTrue(u.cross(v).approxEquals(n, 1e-12));
    }

    @Test
    void pointsOnThePlaneHaveZeroNormalOffset() {
        Point3 origin = new Point3(1, 2, 3);
        SketchCoordinateFrame frame = SketchCoordinateFrame
                .fromOriginNormal(origin, new Vector3(-2, 1, 5)).orElseThrow();
        for (Point2 p : SAMPLES) {
            assertEquals(0.0, frame.to3d(p).subtract(origin).dot(frame.getNormal()), 1e-9);
        }
    }

    @Test
    void zeroNormalHasNoFrame() {
        assertTrue(SketchCoordinateFrame.fromOriginNormal(Point3.ORIGIN, Vector3.ZERO).isEmpty());
        assertTrue(SketchCoordinateFrame.fromOriginNormal(Point3.ORIGIN, new Vector3(1e-9, 0, 0)).isEmpty());
    }

    @Test
    void fromFaceMatchesBoxFaceNormals() {
        Solid box = Primitives.makeBox(2, 3, 4);
        for (Face face : box.getFaces()) {
            SketchCoordinateFrame frame = SketchCoordinateFrame.fromFace(face, box).orElseThrow();
            Vector3 expected = ((SurfaceType.Planar) face.getSurface()).normal();
            assertTrue(frame.getNormal().approxEquals(expected, 1e-9), face + " -> " + frame);

            Point3 first = box.point(face.boundaryVertices(box).get(0)).orElseThrow();
            assertTrue(frame.getOrigin().approxEquals(first));
            Point2 local = frame.from3d(first);
            assertEquals(0.0, local.x(), 1e-12);
            assertEquals(0.0, local.y(), 1e-12);
        }
    }

    @Test
    void fromFaceWorksOnSmallFaces() {
        Solid box = Primitives.makeBox(5e-4, 5e-4, 5e-4);
        for (Face face : box.getFaces()) {
            SketchCoordinateFrame frame = SketchCoordinateFrame.fromFace(face, box).orElseThrow();
            Vector3 expected = ((SurfaceType.Planar) face.getSurface()).normal();
            assertTrue(frame.getNormal().approxEquals(expected, 1e-9), face + " -> " + frame);
            assertEquals(1.0, frame.getUAxis().length(), 1e-12);
            assertEquals(0.0, frame.getUAxis().dot(frame.getNormal()), 1e-12);
        }
    }

    @Test
    void fromFaceOnNearlyCollinearVerticesIsEmpty() {
        Solid solid = new Solid();
        VertexId a = solid.addVertex(new Point3(0, 0, 0));
        VertexId b = solid.addVertex(new Point3(1000, 0, 0));
        VertexId c = solid.addVertex(new Point3(2000, 1e-4, 0));
        FaceId id = solid.addFace(new SurfaceType.Planar(Vector3.Z));
        solid.face(id).orElseThrow().setOuterLoop(new Loop()
                .addEdge(solid.addEdge(a, b), true)
                .addEdge(solid.addEdge(b, c), true)
                .addEdge(solid.addEdge(c, a), true));

        assertTrue(SketchCoordinateFrame.fromFace(solid.face(id).orElseThrow(), solid).isEmpty());
    }

    @Test
    void fromFaceOnCollinearVerticesIsEmpty() {
        Solid solid = new Solid();
        VertexId a = solid.addVertex(new Point3(0, 0, 0));
        VertexId b = solid.addVertex(new Point3(1, 0, 0));
        VertexId c = solid.addVertex(new Point3(2, 0, 0));
        EdgeId ab = solid.addEdge(a, b);
        EdgeId bc = solid.addEdge(b, c);
        EdgeId ca = solid.addEdge(c, a);
        FaceId id = solid.addFace(new SurfaceType.Planar(Vector3.Z));
        Face face = solid.face(id).orElseThrow();
        face.setOuterLoop(new Loop().addEdge(ab, true).addEdge(bc, true).addEdge(ca, true));

        assertTrue(SketchCoordinateFrame.fromFace(face, solid).isEmpty());
    }

    @Test
    void fromFaceWithTooFewVerticesIsEmpty() {
        Solid solid = new Solid();
        VertexId a = solid.addVertex(new Point3(0, 0, 0));
        VertexId b = solid.addVertex(new Point3(1, 0, 0));
        EdgeId ab = solid.addEdge(a, b);
        FaceId id = solid.addFace(new SurfaceType.Planar(Vector3.Z));
        Face face = solid.face(id).orElseThrow();
        face.setOuterLoop(new Loop().addEdge(ab, true).addEdge(ab, false).addEdge(new EdgeId(9), true));

        Optional<SketchCoordinateFrame> frame = SketchCoordinateFrame.fromFace(face, solid);
        assertTrue(frame.isEmpty());
    }
}
