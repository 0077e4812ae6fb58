package nl.bytesoflife.deltabrep.topology;

/**
 * Straight edge between two vertices.
 *
 * Storage is directed (start to end) but the edge itself carries no
 * orientation; each {@link LoopEntry} that references it decides the
 * traversal direction.
 */
public class Edge {

    private final EdgeId id;
    private final VertexId start;
    private final VertexId end;

    public Edge(EdgeId id, VertexId start, VertexId end) {
        this.id = id;
        this.start = start;
        this.end = end;
    }

    public EdgeId getId() {
        return id;
    }

    public VertexId getStart() {
        return start;
    }

    public VertexId getEnd() {
        return end;
    }

    /** Vertex a traversal begins at. */
    public VertexId startFor(boolean forward) {
        return forward ? start : end;
    }

    /** Vertex a traversal finishes at. */
    public VertexId endFor(boolean forward) {
        return forward ? end : start;
    }

    @Override
    public String toString() {
        return id + "[" + start + " -> " + end + "]";
    }
}
