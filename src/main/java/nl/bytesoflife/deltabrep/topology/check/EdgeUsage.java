package nl.bytesoflife.deltabrep.topology.check;

import nl.bytesoflife.deltabrep.topology.EdgeId;
import nl.bytesoflife.deltabrep.topology.FaceId;
import nl.bytesoflife.deltabrep.topology.LoopEntry;
import nl.bytesoflife.deltabrep.topology.Shell;
import nl.bytesoflife.deltabrep.topology.Solid;

import java.util.Map;
import java.util.TreeMap;
import java.util.Comparator;

/**
 * Count of forward and reversed uses of one edge within a shell.
 */
record EdgeUsage(int forward, int reversed) {

    int total() {
        return forward + reversed;
    }

    EdgeUsage plus(boolean isForward) {
        return isForward ? new EdgeUsage(forward + 1, reversed) : new EdgeUsage(forward, reversed + 1);
    }

    static Map<EdgeId, EdgeUsage> collect(Solid solid, Shell shell) {
        Map<EdgeId, EdgeUsage> usages = new TreeMap<>(Comparator.comparingInt(EdgeId::index));
        for (FaceId faceId : shell.getFaces()) {
            solid.face(faceId).ifPresent(face -> {
                for (LoopEntry entry : face.getOuterLoop().getEntries()) {
                    usages.merge(entry.edge(), new EdgeUsage(0, 0).plus(entry.forward()),
                            (a, b) -> new EdgeUsage(a.forward + b.forward, a.reversed + b.reversed));
                }
            });
        }
        return usages;
    }
}
