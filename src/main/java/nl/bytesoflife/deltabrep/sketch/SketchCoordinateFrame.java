package nl.bytesoflife.deltabrep.sketch;

import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.geometry.Tolerance;
import nl.bytesoflife.deltabrep.geometry.Vector3;
import nl.bytesoflife.deltabrep.topology.Face;
import nl.bytesoflife.deltabrep.topology.Solid;
import nl.bytesoflife.deltabrep.topology.VertexId;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A plane embedded in 3D: an origin plus an orthonormal basis
 * ({@code uAxis}, {@code vAxis}, {@code normal}) with
 * {@code uAxis x vAxis = normal}.
 *
 * Factories return empty instead of a frame when the input is degenerate.
 */
public final class SketchCoordinateFrame {

    public static final SketchCoordinateFrame WORLD_XY =
            new SketchCoordinateFrame(Point3.ORIGIN, Vector3.Z, Vector3.X, Vector3.Y);
    public static final SketchCoordinateFrame WORLD_YZ =
            new SketchCoordinateFrame(Point3.ORIGIN, Vector3.X, Vector3.Y, Vector3.Z);
    public static final SketchCoordinateFrame WORLD_XZ =
            new SketchCoordinateFrame(Point3.ORIGIN, Vector3.NEG_Y, Vector3.X, Vector3.Z);

    private final Point3 origin;
    private final Vector3 normal;
    private final Vector3 uAxis;
    private final Vector3 vAxis;

    private SketchCoordinateFrame(Point3 origin, Vector3 normal, Vector3 uAxis, Vector3 vAxis) {
        this.origin = origin;
        this.normal = normal;
        this.uAxis = uAxis;
        this.vAxis = vAxis;
    }

    /**
     * Frame through {@code origin} perpendicular to {@code normal}.
     *
     * The in-plane U axis comes from Gram-Schmidt against the world axis in
     * which the normal has its smallest component, so the reference is never
     * close to parallel with the normal.
     */
    public static Optional<SketchCoordinateFrame> fromOriginNormal(Point3 origin, Vector3 normal) {
        Optional<Vector3> n = normal.normalize();
        if (n.isEmpty()) {
            return Optional.empty();
        }
        Vector3 unitNormal = n.get();

        double ax = Math.abs(unitNormal.x());
        double ay = Math.abs(unitNormal.y());
        double az = Math.abs(unitNormal.z());
        Vector3 reference;
        if (ax <= ay && ax <= az) {
            reference = Vector3.X;
        } else if (ay <= az) {
            reference = Vector3.Y;
        } else {
            reference = Vector3.Z;
        }

        Optional<Vector3> u = reference.subtract(unitNormal.scale(reference.dot(unitNormal))).normalize();
        if (u.isEmpty()) {
            return Optional.empty();
        }
        Vector3 v = unitNormal.cross(u.get());
        return Optional.of(new SketchCoordinateFrame(origin, unitNormal, u.get(), v));
    }

    /**
     * Frame on a face, built from its first three boundary vertices: the
     * origin at the first, U along the first edge, and the normal from the
     * cross product of the first two edge vectors.
     */
    public static Optional<SketchCoordinateFrame> fromFace(Face face, Solid solid) {
        List<Point3> points = new ArrayList<>(3);
        for (VertexId id : face.boundaryVertices(solid)) {
            solid.point(id).ifPresent(points::add);
            if (points.size() == 3) {
                break;
            }
        }
        if (points.size() < 3) {
            return Optional.empty();
        }

        Point3 p0 = points.get(0);
        Vector3 e1 = points.get(1).subtract(p0);
        Vector3 e2 = points.get(2).subtract(p0);

        // Collinearity is judged on the sine of the angle between the edges, independent of face size.
        double l1 = e1.length();
        double l2 = e2.length();
        Vector3 cross = e1.cross(e2);
        double crossLength = cross.length();
        if (l1 == 0 || l2 == 0 || !(crossLength > Tolerance.EPSILON * l1 * l2)) {
            return Optional.empty();
        }
        Vector3 n = cross.scale(1 / crossLength);
        Vector3 u = e1.scale(1 / l1);
        return Optional.of(new SketchCoordinateFrame(p0, n, u, n.cross(u)));
    }

    public Point3 to3d(Point2 p) {
        return origin.add(uAxis.scale(p.x())).add(vAxis.scale(p.y()));
    }

    public Point2 from3d(Point3 p) {
        Vector3 d = p.subtract(origin);
        return new Point2(d.dot(uAxis), d.dot(vAxis));
    }

    public Point3 getOrigin() {
        return origin;
    }

    public Vector3 getNormal() {
        return normal;
    }

    public Vector3 getUAxis() {
        return uAxis;
    }

    public Vector3 getVAxis() {
        return vAxis;
    }

    @Override
    public String toString() {
        return "SketchCoordinateFrame[origin=" + origin + ", normal=" + normal
                + ", u=" + uAxis + ", v=" + vAxis + "]";
    }
}
