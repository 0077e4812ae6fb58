package nl.bytesoflife.deltabrep.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, closed cycle of directed edge uses bounding a face.
 *
 * The end vertex of each entry must equal the start vertex of the next, and
 * the last entry must end where the first starts. The loop does not enforce
 * this on insertion; see {@code LoopContinuityCheck}.
 */
public class Loop {

    private final List<LoopEntry> entries = new ArrayList<>();

    public Loop addEdge(EdgeId edge, boolean forward) {
        entries.add(new LoopEntry(edge, forward));
        return this;
    }

    public List<LoopEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<EdgeId> edgeIds() {
        return entries.stream().map(LoopEntry::edge).toList();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "Loop" + entries;
    }
}
