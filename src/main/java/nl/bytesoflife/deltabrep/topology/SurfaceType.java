package nl.bytesoflife.deltabrep.topology;

import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.geometry.Vector3;

/**
 * Supporting surface of a face.
 *
 * Only {@link Planar} is exact. Spherical and conical faces are still bounded
 * by straight-edged polygon loops, so their surface type is descriptive
 * metadata for a faceted approximation.
 */
public sealed interface SurfaceType permits SurfaceType.Planar, SurfaceType.Spherical, SurfaceType.Conical {

    /**
     * Outward surface normal near the given point.
     */
    Vector3 normalAt(Point3 point);

    record Planar(Vector3 normal) implements SurfaceType {
        @Override
        public Vector3 normalAt(Point3 point) {
            return normal;
        }
    }

    record Spherical(Point3 center, double radius) implements SurfaceType {
        @Override
        public Vector3 normalAt(Point3 point) {
            return point.subtract(center).normalizeOrZ();
        }
    }

    record Conical(Point3 apex, Vector3 axis, double halfAngle) implements SurfaceType {
        @Override
        public Vector3 normalAt(Point3 point) {
            Vector3 fromApex = point.subtract(apex);
            Vector3 unitAxis = axis.normalizeOrZ();
            Vector3 radial = fromApex.subtract(fromApex.projectOnto(unitAxis));
            if (radial.length() < 1e-9) {
                return unitAxis;
            }
            // Slant normal: rotate the radial direction toward the axis by the half angle.
            Vector3 unitRadial = radial.normalizeOrZ();
            return unitRadial.scale(Math.cos(halfAngle))
                    .add(unitAxis.scale(Math.sin(halfAngle)))
                    .normalizeOrZ();
        }
    }
}
