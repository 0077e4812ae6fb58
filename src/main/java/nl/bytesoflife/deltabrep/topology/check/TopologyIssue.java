package nl.bytesoflife.deltabrep.topology.check;

public class TopologyIssue {

    private final String checkName;
    private final Severity severity;
    private final String description;
    private final String element;

    public TopologyIssue(String checkName, Severity severity, String description, String element) {
        this.checkName = checkName;
        this.severity = severity;
        this.description = description;
        this.element = element;
    }

    public static TopologyIssue error(String checkName, String description, Object element) {
        return new TopologyIssue(checkName, Severity.ERROR, description, String.valueOf(element));
    }

    public static TopologyIssue warning(String checkName, String description, Object element) {
        return new TopologyIssue(checkName, Severity.WARNING, description, String.valueOf(element));
    }

    public String getCheckName() { return checkName; }
    public Severity getSeverity() { return severity; }
    public String getDescription() { return description; }
    public String getElement() { return element; }

    @Override
    public String toString() {
        return "[" + severity + "] " + checkName + ": " + description + " at " + element;
    }
}
