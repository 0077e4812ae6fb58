package nl.bytesoflife.deltabrep.step;

/**
 * High-level part category, used by viewers and exporters to group parts.
 */
public enum PartCategory {
    LUMBER,
    PLYWOOD,
    HARDWARE,
    DECAL
}
