package stableui.contract;

import java.util.List;

/**
 * Thrown before execution starts when a plan is malformed. Carries every problem
 * found, not only the first.
 */
public class PlanValidationException extends RuntimeException {

    private final List<String> problems;

    public PlanValidationException(List<String> problems) {
        super("Invalid plan: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public PlanValidationException(String problem, Throwable cause) {
        super("Invalid plan: " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }
}
