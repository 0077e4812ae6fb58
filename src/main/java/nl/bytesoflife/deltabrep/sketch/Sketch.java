package nl.bytesoflife.deltabrep.sketch;

import nl.bytesoflife.deltabrep.geometry.Point3;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A 2D sketch on a plane: an ordered set of points and the entities built on them.
 *
 * Point and entity handles are issued in increasing order from zero.
 * Constraint solving is not part of the sketch.
 */
public class Sketch {

    private SketchPlane plane;
    private final List<SketchPoint> points = new ArrayList<>();
    private final List<SketchEntity> entities = new ArrayList<>();

    public Sketch(SketchPlane plane) {
        this.plane = Objects.requireNonNull(plane, "plane");
    }

    public SketchPlane getPlane() {
        return plane;
    }

    public void setPlane(SketchPlane plane) {
        this.plane = Objects.requireNonNull(plane, "plane");
    }

    public SketchPointId addPoint(Point2 position) {
        return addPoint(position, false);
    }

    public SketchPointId addConstructionPoint(Point2 position) {
        return addPoint(position, true);
    }

    private SketchPointId addPoint(Point2 position, boolean construction) {
        SketchPointId id = new SketchPointId(points.size());
        points.add(new SketchPoint(id, position, construction));
        return id;
    }

    public Optional<SketchPoint> point(SketchPointId id) {
        if (id == null || id.index() < 0 || id.index() >= points.size()) {
            return Optional.empty();
        }
        return Optional.of(points.get(id.index()));
    }

    public Optional<Point2> position(SketchPointId id) {
        return point(id).map(SketchPoint::position);
    }

    /**
     * Moves a point. Returns false if the handle is unknown.
     */
    public boolean movePoint(SketchPointId id, Point2 position) {
        Optional<SketchPoint> existing = point(id);
        if (existing.isEmpty()) {
            return false;
        }
        points.set(id.index(), existing.get().moveTo(position));
        return true;
    }

    public SketchEntityId addLine(SketchPointId start, SketchPointId end) {
        SketchEntityId id = nextEntityId();
        entities.add(new SketchEntity.Line(id, start, end));
        return id;
    }

    public SketchEntityId addArc(SketchPointId center, SketchPointId start, SketchPointId end,
                                 double radius, boolean ccw) {
        SketchEntityId id = nextEntityId();
        entities.add(new SketchEntity.Arc(id, center, start, end, radius, ccw));
        return id;
    }

    public SketchEntityId addCircle(SketchPointId center, double radius) {
        SketchEntityId id = nextEntityId();
        entities.add(new SketchEntity.Circle(id, center, radius));
        return id;
    }

    public SketchEntityId addPointEntity(SketchPointId point) {
        SketchEntityId id = nextEntityId();
        entities.add(new SketchEntity.Point(id, point));
        return id;
    }

    private SketchEntityId nextEntityId() {
        return new SketchEntityId(entities.size());
    }

    public Optional<SketchEntity> entity(SketchEntityId id) {
        return entities.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    public List<SketchPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public List<SketchEntity> getEntities() {
        return Collections.unmodifiableList(entities);
    }

    /**
     * Entities that reference the given point in any role.
     */
    public List<SketchEntityId> entitiesWithPoint(SketchPointId pointId) {
        return entities.stream()
                .filter(e -> e.referencedPoints().contains(pointId))
                .map(SketchEntity::id)
                .toList();
    }

    public Point3 to3dPoint(Point2 p) {
        return plane.frame().to3d(p);
    }

    public Point2 from3dPoint(Point3 p) {
        return plane.frame().from3d(p);
    }
}
