package nl.bytesoflife.deltabrep.sketch;

public record SketchPointId(int index) {
}
