package nl.bytesoflife.deltabrep.topology.mesh;

import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.geometry.Tolerance;
import nl.bytesoflife.deltabrep.geometry.Vector3;
import nl.bytesoflife.deltabrep.topology.Edge;
import nl.bytesoflife.deltabrep.topology.Face;
import nl.bytesoflife.deltabrep.topology.Solid;
import nl.bytesoflife.deltabrep.topology.VertexId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the faces of a solid into triangles for display.
 *
 * Each outer loop is fan-triangulated from its first vertex, which is exact
 * for the convex facets the primitive generators produce. Faces with fewer
 * than three resolvable vertices are skipped.
 */
public class SolidTessellator {

    private static final Logger log = LoggerFactory.getLogger(SolidTessellator.class);

    public TriangleMesh tessellate(Solid solid) {
        TriangleMesh mesh = new TriangleMesh();
        for (Face face : solid.getFaces()) {
            tessellateFace(face, solid, mesh);
        }
        for (Edge edge : solid.getEdges()) {
            solid.point(edge.getStart()).ifPresent(start ->
                    solid.point(edge.getEnd()).ifPresent(end ->
                            mesh.addEdgeSegment(new EdgeSegment(start, end, edge.getId()))));
        }
        log.debug("Tessellated {} faces into {}", solid.faceCount(), mesh);
        return mesh;
    }

    private void tessellateFace(Face face, Solid solid, TriangleMesh mesh) {
        List<Point3> points = new ArrayList<>();
        for (VertexId id : face.boundaryVertices(solid)) {
            solid.point(id).ifPresent(points::add);
        }
        if (points.size() < 3) {
            log.debug("Skipping face {} with {} boundary vertices", face.getId(), points.size());
            return;
        }

        Vector3 normal = facetNormal(points, face);
        int base = mesh.getVertices().size();
        for (Point3 p : points) {
            mesh.addVertex(p);
        }
        for (int i = 1; i + 1 < points.size(); i++) {
            mesh.addTriangle(new MeshTriangle(base, base + i, base + i + 1, normal, face.getId()));
        }
    }

    // Newell normal of the loop; the surface normal stands in for a zero-area loop.
    static Vector3 facetNormal(List<Point3> points, Face face) {
        double nx = 0;
        double ny = 0;
        double nz = 0;
        for (int i = 0; i < points.size(); i++) {
            Point3 p = points.get(i);
            Point3 q = points.get((i + 1) % points.size());
            nx += (p.y() - q.y()) * (p.z() + q.z());
            ny += (p.z() - q.z()) * (p.x() + q.x());
            nz += (p.x() - q.x()) * (p.y() + q.y());
        }
        Vector3 newell = new Vector3(nx, ny, nz);
        double length = newell.length();
        if (length > 0 && length > Tolerance.EPSILON * maxEdgeLengthSquared(points)) {
            return newell.scale(1 / length);
        }
        return face.getSurface().normalAt(points.get(0));
    }

    private static double maxEdgeLengthSquared(List<Point3> points) {
        double max = 0;
        for (int i = 0; i < points.size(); i++) {
            max = Math.max(max, points.get(i).distanceSquared(points.get((i + 1) % points.size())));
        }
        return max;
    }
}
