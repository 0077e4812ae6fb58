package nl.bytesoflife.deltabrep.topology;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Set of faces forming one connected boundary surface.
 *
 * {@code closed} is declared by whoever builds the shell; the kernel does not
 * derive it. {@code TopologyValidator#isClosed} can compute it on demand.
 */
public class Shell {

    private final ShellId id;
    private final Set<FaceId> faces = new LinkedHashSet<>();
    private boolean closed;

    public Shell(ShellId id) {
        this.id = id;
    }

    public ShellId getId() {
        return id;
    }

    public Set<FaceId> getFaces() {
        return Collections.unmodifiableSet(faces);
    }

    public void addFace(FaceId face) {
        faces.add(face);
    }

    public boolean isClosed() {
        return closed;
    }

    public void setClosed(boolean closed) {
        this.closed = closed;
    }

    @Override
    public String toString() {
        return id + "{faces=" + faces.size() + ", closed=" + closed + "}";
    }
}
