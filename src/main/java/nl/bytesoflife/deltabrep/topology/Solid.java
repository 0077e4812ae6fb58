package nl.bytesoflife.deltabrep.topology;

import nl.bytesoflife.deltabrep.geometry.BoundingBox;
import nl.bytesoflife.deltabrep.geometry.Point3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Arena that owns every vertex, edge, face and shell of one shape.
 *
 * Entities refer to each other only through the integer handles this solid
 * hands out. Handles are issued in increasing order starting at zero and are
 * never reused. They carry no owner tag: a handle from another solid resolves
 * to whatever sits at that index here, or to nothing.
 */
public class Solid {

    private final List<Vertex> vertices = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<Face> faces = new ArrayList<>();
    private final List<Shell> shells = new ArrayList<>();

    private BoundingBox bounds;

    public VertexId addVertex(Point3 point) {
        VertexId id = new VertexId(vertices.size());
        vertices.add(new Vertex(id, point));
        bounds = null;
        return id;
    }

    /**
     * Adds an edge and registers it on both endpoint vertices when they exist.
     */
    public EdgeId addEdge(VertexId start, VertexId end) {
        EdgeId id = new EdgeId(edges.size());
        edges.add(new Edge(id, start, end));
        vertex(start).ifPresent(v -> v.addEdge(id));
        if (!end.equals(start)) {
            vertex(end).ifPresent(v -> v.addEdge(id));
        }
        return id;
    }

    public FaceId addFace(SurfaceType surface) {
        FaceId id = new FaceId(faces.size());
        faces.add(new Face(id, surface));
        return id;
    }

    public ShellId addShell() {
        ShellId id = new ShellId(shells.size());
        shells.add(new Shell(id));
        return id;
    }

    public Optional<Vertex> vertex(VertexId id) {
        return lookup(vertices, id == null ? -1 : id.index());
    }

    public Optional<Edge> edge(EdgeId id) {
        return lookup(edges, id == null ? -1 : id.index());
    }

    public Optional<Face> face(FaceId id) {
        return lookup(faces, id == null ? -1 : id.index());
    }

    public Optional<Shell> shell(ShellId id) {
        return lookup(shells, id == null ? -1 : id.index());
    }

    public Optional<Point3> point(VertexId id) {
        return vertex(id).map(Vertex::getPoint);
    }

    public List<Vertex> getVertices() {
        return Collections.unmodifiableList(vertices);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Face> getFaces() {
        return Collections.unmodifiableList(faces);
    }

    public List<Shell> getShells() {
        return Collections.unmodifiableList(shells);
    }

    public int vertexCount() {
        return vertices.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public int faceCount() {
        return faces.size();
    }

    public int shellCount() {
        return shells.size();
    }

    public boolean isEmpty() {
        return vertices.isEmpty();
    }

    /**
     * Bounding box of all vertex positions, cached until the next vertex is added.
     */
    public BoundingBox boundingBox() {
        if (bounds == null) {
            bounds = BoundingBox.fromPoints(vertices.stream().map(Vertex::getPoint).toList());
        }
        return bounds;
    }

    /**
     * Basic structural sanity check.
     *
     * Returns false for an empty solid, for any handle that does not resolve
     * (edge endpoints, loop edges, shell faces, face back-links), and for a
     * solid whose shells are all closed but whose Euler characteristic
     * V - E + F is odd or exceeds two per shell. It does not prove the shells
     * are 2-manifold.
     */
    public boolean isValid() {
        if (vertices.isEmpty()) {
            return false;
        }
        for (Edge edge : edges) {
            if (vertex(edge.getStart()).isEmpty() || vertex(edge.getEnd()).isEmpty()) {
                return false;
            }
        }
        for (Face face : faces) {
            for (LoopEntry entry : face.getOuterLoop().getEntries()) {
                if (edge(entry.edge()).isEmpty()) {
                    return false;
                }
            }
            if (face.getShell().isPresent() && shell(face.getShell().get()).isEmpty()) {
                return false;
            }
        }
        for (Shell shell : shells) {
            for (FaceId faceId : shell.getFaces()) {
                if (face(faceId).isEmpty()) {
                    return false;
                }
            }
        }
        return isEulerConsistent();
    }

    /**
     * V - E + F, counted over the whole solid.
     */
    public int eulerCharacteristic() {
        return vertices.size() - edges.size() + faces.size();
    }

    private boolean isEulerConsistent() {
        if (shells.isEmpty() || !shells.stream().allMatch(Shell::isClosed)) {
            return true;
        }
        int chi = eulerCharacteristic();
        return chi % 2 == 0 && chi <= 2 * shells.size();
    }

    private static <T> Optional<T> lookup(List<T> list, int index) {
        if (index < 0 || index >= list.size()) {
            return Optional.empty();
        }
        return Optional.of(list.get(index));
    }

    @Override
    public String toString() {
        return "Solid[vertices=" + vertices.size() + ", edges=" + edges.size()
                + ", faces=" + faces.size() + ", shells=" + shells.size() + "]";
    }
}
