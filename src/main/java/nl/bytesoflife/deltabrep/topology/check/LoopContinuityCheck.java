package nl.bytesoflife.deltabrep.topology.check;

import nl.bytesoflife.deltabrep.topology.Edge;
import nl.bytesoflife.deltabrep.topology.Face;
import nl.bytesoflife.deltabrep.topology.LoopEntry;
import nl.bytesoflife.deltabrep.topology.Solid;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Verifies that each face's outer loop chains end-to-start and closes on itself.
 */
public class LoopContinuityCheck implements TopologyCheck {

    public static final String NAME = "loop-continuity";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<TopologyIssue> check(Solid solid) {
        List<TopologyIssue> issues = new ArrayList<>();

        for (Face face : solid.getFaces()) {
            List<LoopEntry> entries = face.getOuterLoop().getEntries();
            if (entries.isEmpty()) {
                issues.add(TopologyIssue.warning(NAME, "Face has an empty outer loop", face.getId()));
                continue;
            }
            if (entries.size() < 3) {
                issues.add(TopologyIssue.error(NAME,
                        "Outer loop has only " + entries.size() + " edge(s)", face.getId()));
            }

            for (int i = 0; i < entries.size(); i++) {
                LoopEntry current = entries.get(i);
                LoopEntry next = entries.get((i + 1) % entries.size());
                Optional<Edge> currentEdge = solid.edge(current.edge());
                Optional<Edge> nextEdge = solid.edge(next.edge());
                if (currentEdge.isEmpty() || nextEdge.isEmpty()) {
                    continue; // dangling edges are reported elsewhere
                }

                var end = currentEdge.get().endFor(current.forward());
                var start = nextEdge.get().startFor(next.forward());
                if (!end.equals(start)) {
                    String what = (i == entries.size() - 1) ? "Loop does not close" : "Loop is broken";
                    issues.add(TopologyIssue.error(NAME,
                            what + ": " + current + " ends at " + end + " but " + next + " starts at " + start,
                            face.getId()));
                }
            }
        }

        return issues;
    }
}
