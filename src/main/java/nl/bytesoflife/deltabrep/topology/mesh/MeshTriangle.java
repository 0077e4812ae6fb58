package nl.bytesoflife.deltabrep.topology.mesh;

import nl.bytesoflife.deltabrep.geometry.Vector3;
import nl.bytesoflife.deltabrep.topology.FaceId;

/**
 * One triangle of a {@link TriangleMesh}: three indices into the mesh vertices,
 * wound counter-clockwise around {@code normal}, and the face it was cut from.
 */
public record MeshTriangle(int a, int b, int c, Vector3 normal, FaceId face) {
}
