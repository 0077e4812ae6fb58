package nl.bytesoflife.deltabrep.topology;

/**
 * Handle to a vertex, valid only within the {@link Solid} that issued it.
 */
public record VertexId(int index) {

    @Override
    public String toString() {
        return "V" + index;
    }
}
