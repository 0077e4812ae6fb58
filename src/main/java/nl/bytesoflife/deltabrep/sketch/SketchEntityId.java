package nl.bytesoflife.deltabrep.sketch;

public record SketchEntityId(int index) {
}
