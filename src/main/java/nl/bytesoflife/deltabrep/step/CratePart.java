package nl.bytesoflife.deltabrep.step;

import nl.bytesoflife.deltabrep.geometry.BoundingBox;

import java.util.Objects;

/**
 * A named, axis-aligned box in world inches, as produced by the crate
 * calculator. The category and metadata are carried along but play no
 * part in the geometry.
 */
public class CratePart {

    private final String id;
    private final String name;
    private final PartCategory category;
    private final BoundingBox bounds;
    private final String metadata;

    public CratePart(String id, String name, PartCategory category, BoundingBox bounds) {
        this(id, name, category, bounds, null);
    }

    public CratePart(String id, String name, PartCategory category, BoundingBox bounds, String metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.category = category;
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        this.metadata = metadata;
    }

    /** Stable identifier; export order is ascending by this value. */
    public String getId() { return id; }
    public String getName() { return name; }
    public PartCategory getCategory() { return category; }
    public BoundingBox getBounds() { return bounds; }
    public String getMetadata() { return metadata; }

    @Override
    public String toString() {
        return "CratePart[" + id + ", " + category + ", " + bounds + "]";
    }
}
