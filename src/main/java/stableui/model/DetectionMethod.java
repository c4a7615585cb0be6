package stableui.model;

/** Which path produced an element or anchor result. */
public enum DetectionMethod {
    STRUCTURAL,
    PERCEPTUAL,
    COMBINED
}
