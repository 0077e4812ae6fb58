package nl.bytesoflife.deltabrep.topology.check;

import nl.bytesoflife.deltabrep.topology.EdgeId;
import nl.bytesoflife.deltabrep.topology.Shell;
import nl.bytesoflife.deltabrep.topology.ShellId;
import nl.bytesoflife.deltabrep.topology.Solid;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs registered topology checks against a solid. Validation is always
 * opt-in; neither the kernel nor the generators invoke it.
 *
 * <pre>
 * TopologyReport report = TopologyValidator.withDefaultChecks().validate(solid);
 * </pre>
 */
public class TopologyValidator {

    private final List<TopologyCheck> checks = new ArrayList<>();

    public static TopologyValidator withDefaultChecks() {
        return new TopologyValidator()
                .registerCheck(new DanglingReferenceCheck())
                .registerCheck(new LoopContinuityCheck())
                .registerCheck(new EdgeUseCheck())
                .registerCheck(new EulerCharacteristicCheck());
    }

    public TopologyValidator registerCheck(TopologyCheck check) {
        checks.add(check);
        return this;
    }

    public TopologyReport validate(Solid solid) {
        TopologyReport report = new TopologyReport();
        for (TopologyCheck check : checks) {
            for (TopologyIssue issue : check.check(solid)) {
                report.addIssue(issue);
            }
        }
        return report;
    }

    /**
     * Computes whether a shell is closed: non-empty, and every edge of every
     * face loop is shared by exactly two faces with opposite directions.
     * The shell's own {@code closed} flag is ignored.
     */
    public static boolean isClosed(Solid solid, ShellId shellId) {
        Optional<Shell> shell = solid.shell(shellId);
        if (shell.isEmpty() || shell.get().getFaces().isEmpty()) {
            return false;
        }
        Map<EdgeId, EdgeUsage> usages = EdgeUsage.collect(solid, shell.get());
        if (usages.isEmpty()) {
            return false;
        }
        return usages.values().stream().allMatch(u -> u.forward() == 1 && u.reversed() == 1);
    }
}
