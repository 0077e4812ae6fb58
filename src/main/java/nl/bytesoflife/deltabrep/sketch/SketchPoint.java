package nl.bytesoflife.deltabrep.sketch;

/**
 * A sketch point. Construction points are guides and take no part in profiles.
 */
public record SketchPoint(SketchPointId id, Point2 position, boolean construction) {

    SketchPoint moveTo(Point2 newPosition) {
        return new SketchPoint(id, newPosition, construction);
    }
}
