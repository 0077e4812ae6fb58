package nl.bytesoflife.deltabrep.topology;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bounded region of a surface. Only an outer loop is modeled; holes are not.
 */
public class Face {

    private final FaceId id;
    private final SurfaceType surface;
    private Loop outerLoop = new Loop();
    private ShellId shell;

    public Face(FaceId id, SurfaceType surface) {
        this.id = id;
        this.surface = surface;
    }

    public FaceId getId() {
        return id;
    }

    public SurfaceType getSurface() {
        return surface;
    }

    public Loop getOuterLoop() {
        return outerLoop;
    }

    public void setOuterLoop(Loop outerLoop) {
        this.outerLoop = outerLoop;
    }

    public Optional<ShellId> getShell() {
        return Optional.ofNullable(shell);
    }

    public void setShell(ShellId shell) {
        this.shell = shell;
    }

    public List<EdgeId> edgeIds() {
        return outerLoop.edgeIds();
    }

    /**
     * Vertices visited when walking the outer loop, one per entry, honouring
     * each entry's direction. Entries whose edge cannot be resolved in
     * {@code solid} are skipped.
     */
    public List<VertexId> boundaryVertices(Solid solid) {
        List<VertexId> result = new ArrayList<>();
        for (LoopEntry entry : outerLoop.getEntries()) {
            solid.edge(entry.edge())
                    .ifPresent(e -> result.add(e.startFor(entry.forward())));
        }
        return result;
    }

    @Override
    public String toString() {
        return id + "{" + surface + ", " + outerLoop + "}";
    }
}
