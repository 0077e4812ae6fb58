package nl.bytesoflife.deltabrep.topology.check;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TopologyReport {

    private final List<TopologyIssue> issues = new ArrayList<>();

    public void addIssue(TopologyIssue issue) {
        issues.add(issue);
    }

    public List<TopologyIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public List<TopologyIssue> getErrors() {
        return issues.stream()
                .filter(i -> i.getSeverity() == Severity.ERROR)
                .toList();
    }

    public List<TopologyIssue> getWarnings() {
        return issues.stream()
                .filter(i -> i.getSeverity() == Severity.WARNING)
                .toList();
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.getSeverity() == Severity.ERROR);
    }

    public List<TopologyIssue> getIssuesFrom(String checkName) {
        return issues.stream()
                .filter(i -> i.getCheckName().equals(checkName))
                .toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Topology Report:\n");
        sb.append("  Issues: ").append(issues.size())
          .append(" (").append(getErrors().size()).append(" errors, ")
          .append(getWarnings().size()).append(" warnings)\n");
        for (TopologyIssue issue : issues) {
            sb.append("  - ").append(issue).append("\n");
        }
        return sb.toString();
    }
}
