package nl.bytesoflife.deltabrep.topology.mesh;

import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.topology.FaceId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Triangle soup produced from a solid. Vertices are not shared between
 * faces, so every face owns a contiguous run of vertices and triangles.
 * Edge segments keep the solid's edges for wireframe display and picking.
 */
public class TriangleMesh {

    private final List<Point3> vertices = new ArrayList<>();
    private final List<MeshTriangle> triangles = new ArrayList<>();
    private final List<EdgeSegment> edgeSegments = new ArrayList<>();

    int addVertex(Point3 p) {
        vertices.add(p);
        return vertices.size() - 1;
    }

    void addTriangle(MeshTriangle triangle) {
        triangles.add(triangle);
    }

    void addEdgeSegment(EdgeSegment segment) {
        edgeSegments.add(segment);
    }

    public List<Point3> getVertices() {
        return Collections.unmodifiableList(vertices);
    }

    public List<MeshTriangle> getTriangles() {
        return Collections.unmodifiableList(triangles);
    }

    public List<EdgeSegment> getEdgeSegments() {
        return Collections.unmodifiableList(edgeSegments);
    }

    public int vertexCount() {
        return vertices.size();
    }

    public int triangleCount() {
        return triangles.size();
    }

    public List<MeshTriangle> trianglesOf(FaceId face) {
        return triangles.stream().filter(t -> t.face().equals(face)).toList();
    }

    /**
     * Sum of the triangle areas.
     */
    public double surfaceArea() {
        double area = 0;
        for (MeshTriangle t : triangles) {
            Point3 a = vertices.get(t.a());
            area += vertices.get(t.b()).subtract(a).cross(vertices.get(t.c()).subtract(a)).length() / 2;
        }
        return area;
    }

    @Override
    public String toString() {
        return "TriangleMesh[vertices=" + vertices.size() + ", triangles=" + triangles.size()
                + ", edges=" + edgeSegments.size() + "]";
    }
}
