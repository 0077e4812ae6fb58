package nl.bytesoflife.deltabrep.topology.check;

import nl.bytesoflife.deltabrep.topology.Edge;
import nl.bytesoflife.deltabrep.topology.Face;
import nl.bytesoflife.deltabrep.topology.FaceId;
import nl.bytesoflife.deltabrep.topology.LoopEntry;
import nl.bytesoflife.deltabrep.topology.Shell;
import nl.bytesoflife.deltabrep.topology.Solid;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports handles that do not resolve inside the solid, and an empty solid.
 */
public class DanglingReferenceCheck implements TopologyCheck {

    public static final String NAME = "dangling-reference";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<TopologyIssue> check(Solid solid) {
        List<TopologyIssue> issues = new ArrayList<>();

        if (solid.isEmpty()) {
            issues.add(TopologyIssue.error(NAME, "Solid has no vertices", solid));
        }

        for (Edge edge : solid.getEdges()) {
            if (solid.vertex(edge.getStart()).isEmpty()) {
                issues.add(TopologyIssue.error(NAME, "Unknown start vertex " + edge.getStart(), edge.getId()));
            }
            if (solid.vertex(edge.getEnd()).isEmpty()) {
                issues.add(TopologyIssue.error(NAME, "Unknown end vertex " + edge.getEnd(), edge.getId()));
            }
        }

        for (Face face : solid.getFaces()) {
            for (LoopEntry entry : face.getOuterLoop().getEntries()) {
                if (solid.edge(entry.edge()).isEmpty()) {
                    issues.add(TopologyIssue.error(NAME, "Loop references unknown edge " + entry.edge(), face.getId()));
                }
            }
            face.getShell().ifPresent(shellId -> {
                if (solid.shell(shellId).isEmpty()) {
                    issues.add(TopologyIssue.error(NAME, "Face belongs to unknown shell " + shellId, face.getId()));
                }
            });
        }

        for (Shell shell : solid.getShells()) {
            for (FaceId faceId : shell.getFaces()) {
                if (solid.face(faceId).isEmpty()) {
                    issues.add(TopologyIssue.error(NAME, "Shell references unknown face " + faceId, shell.getId()));
                }
            }
        }

        return issues;
    }
}
