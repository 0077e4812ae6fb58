package nl.bytesoflife.deltabrep.sketch;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts sketch entities into JTS geometries in plane-local coordinates.
 * Arcs and circles are linearized.
 */
public class SketchGeometryConverter {

    private static final int ARC_SEGMENTS = 32;
    private final GeometryFactory factory = new GeometryFactory();

    /**
     * Converts every entity whose points resolve. Construction-only entities
     * are skipped unless {@code includeConstruction} is set.
     */
    public List<Geometry> convert(Sketch sketch, boolean includeConstruction) {
        List<Geometry> geometries = new ArrayList<>();

        for (SketchEntity entity : sketch.getEntities()) {
            if (!includeConstruction && isConstruction(sketch, entity)) {
                continue;
            }
            Geometry geom = convertEntity(sketch, entity);
            if (geom != null && !geom.isEmpty()) {
                geometries.add(geom);
            }
        }

        return geometries;
    }

    public List<Geometry> convert(Sketch sketch) {
        return convert(sketch, false);
    }

    /**
     * 2D extent of the converted geometry; a null envelope for an empty sketch.
     */
    public Envelope envelope(Sketch sketch) {
        Envelope envelope = new Envelope();
        for (Geometry geom : convert(sketch, true)) {
            envelope.expandToInclude(geom.getEnvelopeInternal());
        }
        return envelope;
    }

    public Geometry convertEntity(Sketch sketch, SketchEntity entity) {
        if (entity instanceof SketchEntity.Line line) {
            return convertLine(sketch, line);
        } else if (entity instanceof SketchEntity.Arc arc) {
            return convertArc(sketch, arc);
        } else if (entity instanceof SketchEntity.Circle circle) {
            return convertCircle(sketch, circle);
        } else if (entity instanceof SketchEntity.Point point) {
            return sketch.position(point.point())
                    .map(p -> (Geometry) factory.createPoint(new Coordinate(p.x(), p.y())))
                    .orElse(null);
        }
        return null;
    }

    private Geometry convertLine(Sketch sketch, SketchEntity.Line line) {
        Optional<Point2> start = sketch.position(line.start());
        Optional<Point2> end = sketch.position(line.end());
        if (start.isEmpty() || end.isEmpty()) return null;

        return factory.createLineString(new Coordinate[]{
                new Coordinate(start.get().x(), start.get().y()),
                new Coordinate(end.get().x(), end.get().y())
        });
    }

    private Geometry convertArc(Sketch sketch, SketchEntity.Arc arc) {
        Optional<Point2> center = sketch.position(arc.center());
        Optional<Point2> start = sketch.position(arc.start());
        Optional<Point2> end = sketch.position(arc.end());
        if (center.isEmpty() || start.isEmpty() || end.isEmpty()) return null;

        List<Coordinate> coords = arcToCoordinates(start.get(), end.get(), center.get(), arc.radius(), arc.ccw());
        if (coords.size() < 2) return null;
        return factory.createLineString(coords.toArray(new Coordinate[0]));
    }

    private Geometry convertCircle(Sketch sketch, SketchEntity.Circle circle) {
        Optional<Point2> center = sketch.position(circle.center());
        if (center.isEmpty() || circle.radius() <= 0) return null;

        Coordinate[] ring = new Coordinate[ARC_SEGMENTS + 1];
        for (int i = 0; i < ARC_SEGMENTS; i++) {
            double angle = 2 * Math.PI * i / ARC_SEGMENTS;
            ring[i] = new Coordinate(
                    center.get().x() + circle.radius() * Math.cos(angle),
                    center.get().y() + circle.radius() * Math.sin(angle));
        }
        ring[ARC_SEGMENTS] = new Coordinate(ring[0]);
        return factory.createPolygon(ring);
    }

    /**
     * Samples an arc around {@code center} from {@code start} to {@code end}.
     * Coincident start and end give a full circle. The radius is taken from
     * the entity; the start point only fixes the starting angle.
     */
    List<Coordinate> arcToCoordinates(Point2 start, Point2 end, Point2 center, double radius, boolean ccw) {
        List<Coordinate> coords = new ArrayList<>();

        double startAngle = Math.atan2(start.y() - center.y(), start.x() - center.x());
        double endAngle = Math.atan2(end.y() - center.y(), end.x() - center.x());
        double r = radius > 0 ? radius : start.distance(center);

        double sweep;
        if (ccw) {
            sweep = endAngle - startAngle;
            if (sweep <= 0) sweep += 2 * Math.PI;
        } else {
            sweep = startAngle - endAngle;
            if (sweep <= 0) sweep += 2 * Math.PI;
        }

        // Full circle
        if (start.distance(end) < 0.0001) {
            sweep = 2 * Math.PI;
        }

        int segments = Math.max(8, (int) (sweep / (2 * Math.PI) * ARC_SEGMENTS));
        for (int i = 0; i <= segments; i++) {
            double t = (double) i / segments;
            double angle = ccw ? startAngle + sweep * t : startAngle - sweep * t;
            coords.add(new Coordinate(center.x() + r * Math.cos(angle), center.y() + r * Math.sin(angle)));
        }

        return coords;
    }

    private static boolean isConstruction(Sketch sketch, SketchEntity entity) {
        List<SketchPointId> refs = entity.referencedPoints();
        return !refs.isEmpty() && refs.stream()
                .allMatch(id -> sketch.point(id).map(SketchPoint::construction).orElse(false));
    }
}
