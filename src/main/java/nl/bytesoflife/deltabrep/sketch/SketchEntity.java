package nl.bytesoflife.deltabrep.sketch;

import java.util.List;

/**
 * 2D sketch entity. Entities reference sketch points by handle.
 */
public sealed interface SketchEntity
        permits SketchEntity.Line, SketchEntity.Arc, SketchEntity.Circle, SketchEntity.Point {

    SketchEntityId id();

    List<SketchPointId> referencedPoints();

    record Line(SketchEntityId id, SketchPointId start, SketchPointId end) implements SketchEntity {
        @Override
        public List<SketchPointId> referencedPoints() {
            return List.of(start, end);
        }
    }

    /**
     * @param ccw true when the arc runs counter-clockwise from start to end
     */
    record Arc(SketchEntityId id, SketchPointId center, SketchPointId start, SketchPointId end,
               double radius, boolean ccw) implements SketchEntity {
        @Override
        public List<SketchPointId> referencedPoints() {
            return List.of(center, start, end);
        }
    }

    record Circle(SketchEntityId id, SketchPointId center, double radius) implements SketchEntity {
        @Override
        public List<SketchPointId> referencedPoints() {
            return List.of(center);
        }
    }

    record Point(SketchEntityId id, SketchPointId point) implements SketchEntity {
        @Override
        public List<SketchPointId> referencedPoints() {
            return List.of(point);
        }
    }
}
