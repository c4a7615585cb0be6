package stableui.model;

import java.util.Objects;

/** A requested target as found during analysis, with the method that found it. */
public record ScreenElement(String name, InteractiveElement element, double confidence, DetectionMethod method) {

    public ScreenElement {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(method, "method");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range [0,1]: " + confidence);
        }
    }
}
