package nl.bytesoflife.deltabrep.topology;

/**
 * Handle to an edge, valid only within the {@link Solid} that issued it.
 */
public record EdgeId(int index) {

    @Override
    public String toString() {
        return "E" + index;
    }
}
