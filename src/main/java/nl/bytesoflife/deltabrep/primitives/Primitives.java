package nl.bytesoflife.deltabrep.primitives;

import nl.bytesoflife.deltabrep.geometry.Point3;
import nl.bytesoflife.deltabrep.geometry.Vector3;
import nl.bytesoflife.deltabrep.topology.EdgeId;
import nl.bytesoflife.deltabrep.topology.FaceId;
import nl.bytesoflife.deltabrep.topology.Loop;
import nl.bytesoflife.deltabrep.topology.ShellId;
import nl.bytesoflife.deltabrep.topology.Solid;
import nl.bytesoflife.deltabrep.topology.SurfaceType;
import nl.bytesoflife.deltabrep.topology.VertexId;

import java.util.ArrayList;
import java.util.List;

/**
 * Generators for closed primitive solids.
 *
 * Every generator allocates vertices first, then edges, then faces, and
 * finishes with a single closed shell holding every face. Face loops are
 * wound counter-clockwise seen from outside, so each edge is walked once
 * forward and once reversed across the shell. Curved surfaces are
 * approximated by planar facets. Parameters are taken as given except
 * segment counts, which are clamped to the smallest count that still
 * encloses a volume. Nothing here validates the result; use
 * {@link Solid#isValid()} or the topology validator afterwards.
 */
public final class Primitives {

    public static final int MIN_SEGMENTS = 3;
    public static final int MIN_SPHERE_LONGITUDE = 4;
    public static final int MIN_SPHERE_LATITUDE = 2;

    private Primitives() {
    }

    // -------------------------------------------------------------------------
    // Box
    // -------------------------------------------------------------------------

    /**
     * Axis-aligned box centered at the origin.
     *
     * @param width  size along X
     * @param depth  size along Y
     * @param height size along Z
     */
    public static Solid makeBox(double width, double depth, double height) {
        return makeBoxAt(Point3.ORIGIN, width, depth, height);
    }

    /**
     * Axis-aligned box centered at {@code center}.
     */
    public static Solid makeBoxAt(Point3 center, double width, double depth, double height) {
        Solid solid = new Solid();

        double hw = width / 2;
        double hd = depth / 2;
        double hh = height / 2;

        // Bottom corners counter-clockwise seen from +Z, then the top corners above them
        VertexId v0 = solid.addVertex(new Point3(center.x() - hw, center.y() - hd, center.z() - hh));
        VertexId v1 = solid.addVertex(new Point3(center.x() + hw, center.y() - hd, center.z() - hh));
        VertexId v2 = solid.addVertex(new Point3(center.x() + hw, center.y() + hd, center.z() - hh));
        VertexId v3 = solid.addVertex(new Point3(center.x() - hw, center.y() + hd, center.z() - hh));
        VertexId v4 = solid.addVertex(new Point3(center.x() - hw, center.y() - hd, center.z() + hh));
        VertexId v5 = solid.addVertex(new Point3(center.x() + hw, center.y() - hd, center.z() + hh));
        VertexId v6 = solid.addVertex(new Point3(center.x() + hw, center.y() + hd, center.z() + hh));
        VertexId v7 = solid.addVertex(new Point3(center.x() - hw, center.y() + hd, center.z() + hh));

        // Bottom ring runs clockwise seen from +Z so the bottom face walks it forward
        EdgeId b0 = solid.addEdge(v0, v3);
        EdgeId b1 = solid.addEdge(v3, v2);
        EdgeId b2 = solid.addEdge(v2, v1);
        EdgeId b3 = solid.addEdge(v1, v0);

        EdgeId t0 = solid.addEdge(v4, v5);
        EdgeId t1 = solid.addEdge(v5, v6);
        EdgeId t2 = solid.addEdge(v6, v7);
        EdgeId t3 = solid.addEdge(v7, v4);

        EdgeId s0 = solid.addEdge(v0, v4);
        EdgeId s1 = solid.addEdge(v1, v5);
        EdgeId s2 = solid.addEdge(v2, v6);
        EdgeId s3 = solid.addEdge(v3, v7);

        List<FaceId> faces = new ArrayList<>();

        faces.add(addFace(solid, new SurfaceType.Planar(Vector3.NEG_Z),
                new Loop().addEdge(b0, true).addEdge(b1, true).addEdge(b2, true).addEdge(b3, true)));
        faces.add(addFace(solid, new SurfaceType.Planar(Vector3.Z),
                new Loop().addEdge(t0, true).addEdge(t1, true).addEdge(t2, true).addEdge(t3, true)));

        // Side i walks bottom corner i -> i+1, up, back along the top, down
        faces.add(addFace(solid, new SurfaceType.Planar(Vector3.NEG_Y), sideLoop(b3, s1, t0, s0)));
        faces.add(addFace(solid, new SurfaceType.Planar(Vector3.X), sideLoop(b2, s2, t1, s1)));
        faces.add(addFace(solid, new SurfaceType.Planar(Vector3.Y), sideLoop(b1, s3, t2, s2)));
        faces.add(addFace(solid, new SurfaceType.Planar(Vector3.NEG_X), sideLoop(b0, s0, t3, s3)));

        closeShell(solid, faces);
        return solid;
    }

    // -------------------------------------------------------------------------
    // Cylinder
    // -------------------------------------------------------------------------

    /**
     * Cylinder along Z centered at the origin.
     *
     * @param segments facets around the side wall, at least {@value #MIN_SEGMENTS}
     */
    public static Solid makeCylinder(double radius, double height, int segments) {
        return makeCylinderAt(Point3.ORIGIN, radius, height, segments);
    }

    /**
     * Cylinder along Z centered at {@code center}.
     */
    public static Solid makeCylinderAt(Point3 center, double radius, double height, int segments) {
        Solid solid = new Solid();
        int n = Math.max(segments, MIN_SEGMENTS);
        double hh = height / 2;

        List<Point3> ring = circle(center, radius, n);
        List<VertexId> bottom = new ArrayList<>(n);
        List<VertexId> top = new ArrayList<>(n);
        for (Point3 p : ring) {
            bottom.add(solid.addVertex(new Point3(p.x(), p.y(), center.z() - hh)));
        }
        for (Point3 p : ring) {
            top.add(solid.addVertex(new Point3(p.x(), p.y(), center.z() + hh)));
        }

        List<EdgeId> bottomEdges = ringEdges(solid, bottom);
        List<EdgeId> topEdges = ringEdges(solid, top);
        List<EdgeId> verticals = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            verticals.add(solid.addEdge(bottom.get(i), top.get(i)));
        }

        List<FaceId> faces = new ArrayList<>();
        faces.add(addFace(solid, new SurfaceType.Planar(Vector3.NEG_Z), reversedRingLoop(bottomEdges)));
        faces.add(addFace(solid, new SurfaceType.Planar(Vector3.Z), forwardRingLoop(topEdges)));

        for (int i = 0; i < n; i++) {
            int next = (i + 1) % n;
            Point3 mid = ring.get(i).midpoint(ring.get(next));
            Vector3 normal = new Vector3(mid.x() - center.x(), mid.y() - center.y(), 0)
                    .normalize()
                    .orElse(Vector3.X);
            faces.add(addFace(solid, new SurfaceType.Planar(normal),
                    sideLoop(bottomEdges.get(i), verticals.get(next), topEdges.get(i), verticals.get(i), true)));
        }

        closeShell(solid, faces);
        return solid;
    }

    // -------------------------------------------------------------------------
    // Sphere
    // -------------------------------------------------------------------------

    /**
     * Sphere centered at the origin.
     *
     * @param uSegments longitude divisions, at least {@value #MIN_SPHERE_LONGITUDE}
     * @param vSegments latitude divisions, at least {@value #MIN_SPHERE_LATITUDE}
     */
    public static Solid makeSphere(double radius, int uSegments, int vSegments) {
        return makeSphereAt(Point3.ORIGIN, radius, uSegments, vSegments);
    }

    /**
     * Sphere centered at {@code center}: a triangle fan at each pole and
     * quad bands between the {@code vSegments - 1} latitude rings.
     */
    public static Solid makeSphereAt(Point3 center, double radius, int uSegments, int vSegments) {
        Solid solid = new Solid();
        int u = Math.max(uSegments, MIN_SPHERE_LONGITUDE);
        int v = Math.max(vSegments, MIN_SPHERE_LATITUDE);
        SurfaceType surface = new SurfaceType.Spherical(center, radius);

        VertexId northPole = solid.addVertex(new Point3(center.x(), center.y(), center.z() + radius));
        List<List<VertexId>> rings = new ArrayList<>(v - 1);
        for (int j = 1; j < v; j++) {
            double phi = Math.PI * j / v;
            Point3 ringCenter = new Point3(center.x(), center.y(), center.z() + radius * Math.cos(phi));
            List<VertexId> ring = new ArrayList<>(u);
            for (Point3 p : circle(ringCenter, radius * Math.sin(phi), u)) {
                ring.add(solid.addVertex(p));
            }
            rings.add(ring);
        }
        VertexId southPole = solid.addVertex(new Point3(center.x(), center.y(), center.z() - radius));

        List<List<EdgeId>> ringEdges = new ArrayList<>(rings.size());
        for (List<VertexId> ring : rings) {
            ringEdges.add(ringEdges(solid, ring));
        }

        // Meridian segments, all directed from north to south
        List<EdgeId> northMeridians = new ArrayList<>(u);
        for (VertexId vertex : rings.get(0)) {
            northMeridians.add(solid.addEdge(northPole, vertex));
        }
        List<List<EdgeId>> bandMeridians = new ArrayList<>();
        for (int j = 0; j + 1 < rings.size(); j++) {
            List<EdgeId> meridians = new ArrayList<>(u);
            for (int i = 0; i < u; i++) {
                meridians.add(solid.addEdge(rings.get(j).get(i), rings.get(j + 1).get(i)));
            }
            bandMeridians.add(meridians);
        }
        List<EdgeId> southMeridians = new ArrayList<>(u);
        for (VertexId vertex : rings.get(rings.size() - 1)) {
            southMeridians.add(solid.addEdge(vertex, southPole));
        }

        List<FaceId> faces = new ArrayList<>();

        List<EdgeId> firstRing = ringEdges.get(0);
        for (int i = 0; i < u; i++) {
            int next = (i + 1) % u;
            faces.add(addFace(solid, surface, new Loop()
                    .addEdge(northMeridians.get(i), true)
                    .addEdge(firstRing.get(i), true)
                    .addEdge(northMeridians.get(next), false)));
        }

        for (int j = 0; j < bandMeridians.size(); j++) {
            List<EdgeId> meridians = bandMeridians.get(j);
            for (int i = 0; i < u; i++) {
                int next = (i + 1) % u;
                faces.add(addFace(solid, surface, new Loop()
                        .addEdge(meridians.get(i), true)
                        .addEdge(ringEdges.get(j + 1).get(i), true)
                        .addEdge(meridians.get(next), false)
                        .addEdge(ringEdges.get(j).get(i), false)));
            }
        }

        List<EdgeId> lastRing = ringEdges.get(ringEdges.size() - 1);
        for (int i = 0; i < u; i++) {
            int next = (i + 1) % u;
            faces.add(addFace(solid, surface, new Loop()
                    .addEdge(southMeridians.get(i), true)
                    .addEdge(southMeridians.get(next), false)
                    .addEdge(lastRing.get(i), false)));
        }

        closeShell(solid, faces);
        return solid;
    }

    // -------------------------------------------------------------------------
    // Cone
    // -------------------------------------------------------------------------

    /**
     * Cone along Z with its base centered at the origin and apex above it.
     *
     * @param segments facets around the slanted wall, at least {@value #MIN_SEGMENTS}
     */
    public static Solid makeCone(double baseRadius, double height, int segments) {
        return makeConeAt(Point3.ORIGIN, baseRadius, height, segments);
    }

    /**
     * Cone with its base centered at {@code baseCenter} and apex {@code height} above it.
     */
    public static Solid makeConeAt(Point3 baseCenter, double baseRadius, double height, int segments) {
        Solid solid = new Solid();
        int n = Math.max(segments, MIN_SEGMENTS);

        Point3 apexPoint = new Point3(baseCenter.x(), baseCenter.y(), baseCenter.z() + height);
        VertexId apex = solid.addVertex(apexPoint);
        List<VertexId> base = new ArrayList<>(n);
        for (Point3 p : circle(baseCenter, baseRadius, n)) {
            base.add(solid.addVertex(p));
        }

        List<EdgeId> baseEdges = ringEdges(solid, base);
        List<EdgeId> slantEdges = new ArrayList<>(n);
        for (VertexId vertex : base) {
            slantEdges.add(solid.addEdge(apex, vertex));
        }

        List<FaceId> faces = new ArrayList<>();
        faces.add(addFace(solid, new SurfaceType.Planar(Vector3.NEG_Z), reversedRingLoop(baseEdges)));

        SurfaceType slant = new SurfaceType.Conical(apexPoint, Vector3.Z, Math.atan(baseRadius / height));
        for (int i = 0; i < n; i++) {
            int next = (i + 1) % n;
            faces.add(addFace(solid, slant, new Loop()
                    .addEdge(baseEdges.get(i), true)
                    .addEdge(slantEdges.get(next), false)
                    .addEdge(slantEdges.get(i), true)));
        }

        closeShell(solid, faces);
        return solid;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    /**
     * {@code n} points on a circle in the XY plane through {@code center},
     * starting on +X and running counter-clockwise seen from +Z.
     */
    private static List<Point3> circle(Point3 center, double radius, int n) {
        List<Point3> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double angle = 2 * Math.PI * i / n;
            points.add(new Point3(
                    center.x() + radius * Math.cos(angle),
                    center.y() + radius * Math.sin(angle),
                    center.z()));
        }
        return points;
    }

    /** Edges i -> i+1 around a closed ring of vertices. */
    private static List<EdgeId> ringEdges(Solid solid, List<VertexId> ring) {
        List<EdgeId> edges = new ArrayList<>(ring.size());
        for (int i = 0; i < ring.size(); i++) {
            edges.add(solid.addEdge(ring.get(i), ring.get((i + 1) % ring.size())));
        }
        return edges;
    }

    private static Loop forwardRingLoop(List<EdgeId> ringEdges) {
        Loop loop = new Loop();
        for (EdgeId edge : ringEdges) {
            loop.addEdge(edge, true);
        }
        return loop;
    }

    /** Walks a ring backwards, so a cap facing -Z is wound outward. */
    private static Loop reversedRingLoop(List<EdgeId> ringEdges) {
        Loop loop = new Loop();
        for (int i = ringEdges.size() - 1; i >= 0; i--) {
            loop.addEdge(ringEdges.get(i), false);
        }
        return loop;
    }

    /**
     * Box side quad: bottom edge reversed, leading vertical forward, top edge
     * reversed, trailing vertical reversed.
     */
    private static Loop sideLoop(EdgeId bottom, EdgeId up, EdgeId top, EdgeId down) {
        return sideLoop(bottom, up, top, down, false);
    }

    private static Loop sideLoop(EdgeId bottom, EdgeId up, EdgeId top, EdgeId down, boolean bottomForward) {
        return new Loop()
                .addEdge(bottom, bottomForward)
                .addEdge(up, true)
                .addEdge(top, false)
                .addEdge(down, false);
    }

    private static FaceId addFace(Solid solid, SurfaceType surface, Loop loop) {
        FaceId id = solid.addFace(surface);
        solid.face(id).ifPresent(face -> face.setOuterLoop(loop));
        return id;
    }

    private static ShellId closeShell(Solid solid, List<FaceId> faces) {
        ShellId shellId = solid.addShell();
        solid.shell(shellId).ifPresent(shell -> {
            for (FaceId face : faces) {
                shell.addFace(face);
            }
            shell.setClosed(true);
        });
        for (FaceId faceId : faces) {
            solid.face(faceId).ifPresent(face -> face.setShell(shellId));
        }
        return shellId;
    }
}
