package nl.bytesoflife.deltabrep.topology;

/**
 * Handle to a face, valid only within the {@link Solid} that issued it.
 */
public record FaceId(int index) {

    @Override
    public String toString() {
        return "F" + index;
    }
}
