package nl.bytesoflife.deltabrep.topology;

/**
 * Handle to a shell, valid only within the {@link Solid} that issued it.
 */
public record ShellId(int index) {

    @Override
    public String toString() {
        return "S" + index;
    }
}
