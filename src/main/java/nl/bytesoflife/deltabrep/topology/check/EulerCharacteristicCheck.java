package nl.bytesoflife.deltabrep.topology.check;

import nl.bytesoflife.deltabrep.topology.Shell;
import nl.bytesoflife.deltabrep.topology.Solid;

import java.util.ArrayList;
import java.util.List;

/**
 * When every shell is closed, V - E + F must equal the sum of 2 - 2g over
 * the shells: even, and at most two per shell.
 */
public class EulerCharacteristicCheck implements TopologyCheck {

    public static final String NAME = "euler-characteristic";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<TopologyIssue> check(Solid solid) {
        List<TopologyIssue> issues = new ArrayList<>();
        if (solid.getShells().isEmpty() || !solid.getShells().stream().allMatch(Shell::isClosed)) {
            return issues;
        }

        int chi = solid.eulerCharacteristic();
        int limit = 2 * solid.shellCount();
        if (chi % 2 != 0) {
            issues.add(TopologyIssue.error(NAME, "Euler characteristic " + chi + " is odd", solid));
        } else if (chi > limit) {
            issues.add(TopologyIssue.error(NAME,
                    "Euler characteristic " + chi + " exceeds " + limit + " for " + solid.shellCount() + " shell(s)",
                    solid));
        } else if (chi < limit) {
            issues.add(TopologyIssue.warning(NAME,
                    "Euler characteristic " + chi + " implies genus > 0", solid));
        }
        return issues;
    }
}
