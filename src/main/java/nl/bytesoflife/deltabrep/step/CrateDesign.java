package nl.bytesoflife.deltabrep.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of crate parts handed to the STEP exporter.
 */
public class CrateDesign {

    private final List<CratePart> parts = new ArrayList<>();

    public CrateDesign addPart(CratePart part) {
        parts.add(Objects.requireNonNull(part, "part"));
        return this;
    }

    public CrateDesign addParts(List<CratePart> toAdd) {
        for (CratePart part : toAdd) {
            addPart(part);
        }
        return this;
    }

    public List<CratePart> getParts() {
        return Collections.unmodifiableList(parts);
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }
}
