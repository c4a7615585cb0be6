package stableui.controller;

/**
 * What an action is expected to produce, compared against a re-observation of
 * the surface after the action. Every non-null check must hold.
 *
 * @param locationContains substring the surface location must contain afterwards
 * @param textPresent      text the surface must show afterwards
 * @param selectorPresent  selector that must match an indexed element afterwards
 * @param requireChange    whether the structure, elements, location or overlays must differ
 */
public record ExpectedOutcome(String locationContains, String textPresent, String selectorPresent,
                              boolean requireChange) {

    public static ExpectedOutcome changed() {
        return new ExpectedOutcome(null, null, null, true);
    }

    public static ExpectedOutcome locationContains(String fragment) {
        return new ExpectedOutcome(fragment, null, null, false);
    }

    public static ExpectedOutcome textPresent(String text) {
        return new ExpectedOutcome(null, text, null, false);
    }

    public static ExpectedOutcome selectorPresent(String selector) {
        return new ExpectedOutcome(null, null, selector, false);
    }
}
