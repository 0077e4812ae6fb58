package nl.bytesoflife.deltabrep.topology;

import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.geometry.Tolerance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Vertex {

    private final VertexId id;
    private final Point3 point;
    private final List<EdgeId> edges = new ArrayList<>();

    public Vertex(VertexId id, Point3 point) {
        this.id = id;
        this.point = point;
    }

    public VertexId getId() {
        return id;
    }

    public Point3 getPoint() {
        return point;
    }

    /**
     * Edges that start or end at this vertex, in creation order.
     */
    public List<EdgeId> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    void addEdge(EdgeId edge) {
        edges.add(edge);
    }

    public boolean isCoincident(Vertex other) {
        return point.approxEquals(other.point, Tolerance.EPSILON);
    }

    @Override
    public String toString() {
        return id + "(" + point.x() + ", " + point.y() + ", " + point.z() + ")";
    }
}
