package stableui.controller;

/** Path an action was finally executed through. */
public enum ExecutionMethod {
    /** Selector plus structural driver. */
    STRUCTURAL,
    /** Perceptual location plus coordinate input. */
    PERCEPTUAL
}
