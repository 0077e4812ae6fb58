package nl.bytesoflife.deltabrep.sketch;

/**
 * Plane a sketch lives on: one of the world-aligned planes or an arbitrary frame.
 */
public sealed interface SketchPlane permits SketchPlane.Standard, SketchPlane.Arbitrary {

    SketchCoordinateFrame frame();

    enum Standard implements SketchPlane {
        /** (u, v) maps to (x, y, 0). */
        XY(SketchCoordinateFrame.WORLD_XY),
        /** (u, v) maps to (0, x, y). */
        YZ(SketchCoordinateFrame.WORLD_YZ),
        /** (u, v) maps to (x, 0, y). */
        XZ(SketchCoordinateFrame.WORLD_XZ);

        private final SketchCoordinateFrame frame;

        Standard(SketchCoordinateFrame frame) {
            this.frame = frame;
        }

        @Override
        public SketchCoordinateFrame frame() {
            return frame;
        }
    }

    record Arbitrary(SketchCoordinateFrame frame) implements SketchPlane {
    }
}
