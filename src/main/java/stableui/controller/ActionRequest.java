package stableui.controller;

import stableui.model.BoundingBox;
import stableui.model.Operation;
import stableui.model.OperationKind;
import stableui.model.Region;
import stableui.model.TargetSpec;

import java.util.Objects;

/**
 * One action for the {@link DecisionController}.
 *
 * <p>Only {@code click}, {@code type} and {@code scroll} reach the controller;
 * waiting and verification belong to the contract layer.
 *
 * @param target   what to act on; required for click and type, optional for scroll
 * @param roi      region perception should look at; {@code null} for the full viewport
 * @param hint     previously perceived bounding box, used when perception cannot locate the target
 * @param expected optional outcome to verify after the action
 */
public record ActionRequest(Operation operation, TargetSpec target, Region roi, BoundingBox hint,
                            ExpectedOutcome expected) {

    public ActionRequest {
        Objects.requireNonNull(operation, "operation");
        OperationKind kind = operation.kind();
        if (kind == OperationKind.WAIT || kind == OperationKind.VERIFY) {
            throw new IllegalArgumentException(kind.wireName() + " is not an executable action");
        }
        if (operation.needsTarget() && target == null) {
            throw new IllegalArgumentException(kind.wireName() + " needs a target");
        }
    }

    public static ActionRequest click(TargetSpec target) {
        return new ActionRequest(Operation.click(), target, null, null, null);
    }

    public static ActionRequest type(TargetSpec target, String text) {
        return new ActionRequest(Operation.type(text), target, null, null, null);
    }

    public static ActionRequest scroll(TargetSpec target, int dx, int dy) {
        return new ActionRequest(Operation.scroll(dx, dy), target, null, null, null);
    }

    public ActionRequest expecting(ExpectedOutcome outcome) {
        return new ActionRequest(operation, target, roi, hint, outcome);
    }

    public ActionRequest within(Region region) {
        return new ActionRequest(operation, target, region, hint, expected);
    }

    public ActionRequest withHint(BoundingBox box) {
        return new ActionRequest(operation, target, roi, box, expected);
    }

    String describe() {
        return operation.kind().wireName() + (target == null ? "" : " '" + target.name() + "'");
    }
}
