package nl.bytesoflife.deltabrep.topology.check;

import nl.bytesoflife.deltabrep.topology.Solid;

import java.util.List;

public interface TopologyCheck {

    List<TopologyIssue> check(Solid solid);

    String getName();
}
