package nl.bytesoflife.deltabrep.topology;

/**
 * One use of an edge inside a loop, with the direction it is walked in.
 */
public record LoopEntry(EdgeId edge, boolean forward) {

    @Override
    public String toString() {
        return (forward ? "+" : "-") + edge;
    }
}
