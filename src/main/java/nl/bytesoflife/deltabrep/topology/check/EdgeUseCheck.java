package nl.bytesoflife.deltabrep.topology.check;

import nl.bytesoflife.deltabrep.topology.EdgeId;
import nl.bytesoflife.deltabrep.topology.Shell;
import nl.bytesoflife.deltabrep.topology.Solid;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * For every shell declared closed, each edge used by its faces must be used
 * exactly twice: once forward and once reversed.
 */
public class EdgeUseCheck implements TopologyCheck {

    public static final String NAME = "edge-use";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<TopologyIssue> check(Solid solid) {
        List<TopologyIssue> issues = new ArrayList<>();

        for (Shell shell : solid.getShells()) {
            if (!shell.isClosed()) {
                continue;
            }
            Map<EdgeId, EdgeUsage> usages = EdgeUsage.collect(solid, shell);
            for (Map.Entry<EdgeId, EdgeUsage> e : usages.entrySet()) {
                EdgeUsage usage = e.getValue();
                if (usage.total() != 2) {
                    issues.add(TopologyIssue.error(NAME,
                            "Edge used " + usage.total() + " time(s) in closed shell " + shell.getId() + ", expected 2",
                            e.getKey()));
                } else if (usage.forward() != 1) {
                    issues.add(TopologyIssue.error(NAME,
                            "Edge traversed in the same direction by both faces of shell " + shell.getId(),
                            e.getKey()));
                }
            }
        }

        return issues;
    }
}
