package nl.bytesoflife.deltabrep.topology.mesh;

import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.topology.EdgeId;

public record EdgeSegment(Point3 start, Point3 end, EdgeId edge) {

    public double length() {
        return start.distance(end);
    }
}
