package stableui.contract;

/** Outcome of evaluating one condition, with a line fit for the execution log. */
public record ConditionResult(boolean holds, String detail) {

    static ConditionResult pass(String detail) {
        return new ConditionResult(true, detail);
    }

    static ConditionResult fail(String detail) {
        return new ConditionResult(false, detail);
    }
}
