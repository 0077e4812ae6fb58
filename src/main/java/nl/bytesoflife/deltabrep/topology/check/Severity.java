package nl.bytesoflife.deltabrep.topology.check;

public enum Severity {
    ERROR,
    WARNING
}
