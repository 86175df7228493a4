package work.lcod.conveyor.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Append-only list of findings in emission order.
 */
public final class FindingCollector {
    private final List<Finding> findings = new ArrayList<>();

    public void error(String field, String ruleId, String message) {
        findings.add(Finding.error(field, ruleId, message));
    }

    public void warning(String field, String ruleId, String message) {
        findings.add(Finding.warning(field, ruleId, message));
    }

    public void info(String field, String ruleId, String message) {
        findings.add(Finding.info(field, ruleId, message));
    }

    public boolean hasErrorOn(Collection<String> fields) {
        return findings.stream().anyMatch(f -> f.isError() && fields.contains(f.field()));
    }

    public List<Finding> findings() {
        return List.copyOf(findings);
    }
}
