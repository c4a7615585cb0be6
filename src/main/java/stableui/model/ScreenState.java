package stableui.model;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Contract-level description of an analysed surface. Immutable.
 *
 * <p>{@code missing} names requested targets that were not found above the minimum
 * confidence; it never shares a name with {@code elements}.
 */
public record ScreenState(
        String surfaceId,
        Instant timestamp,
        List<ScreenAnchor> anchors,
        List<ScreenElement> elements,
        List<String> warnings,
        List<String> missing,
        String structuralHash) {

    public ScreenState {
        Objects.requireNonNull(surfaceId, "surfaceId");
        Objects.requireNonNull(timestamp, "timestamp");
        anchors  = anchors  == null ? List.of() : List.copyOf(anchors);
        elements = elements == null ? List.of() : List.copyOf(elements);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        missing  = missing  == null ? List.of() : List.copyOf(missing);

        Set<String> names = new HashSet<>();
        for (ScreenElement e : elements) names.add(e.name());
        for (String m : missing) {
            if (names.contains(m)) {
                throw new IllegalArgumentException("Target '" + m + "' is both found and missing");
            }
        }
    }

    /**
     * Rejects a request that names the same anchor or the same target twice.
     *
     * @throws IllegalArgumentException on the first repeated name
     */
    public static void requireDistinctNames(List<AnchorSpec> anchors, List<TargetSpec> targets) {
        Set<String> seen = new HashSet<>();
        for (AnchorSpec a : anchors) {
            if (!seen.add(a.name())) throw new IllegalArgumentException("Duplicate anchor name: '" + a.name() + "'");
        }
        seen.clear();
        for (TargetSpec t : targets) {
            if (!seen.add(t.name())) throw new IllegalArgumentException("Duplicate target name: '" + t.name() + "'");
        }
    }

    /** A state carrying nothing but the surface id, used when analysis could not run at all. */
    public static ScreenState empty(String surfaceId, String warning) {
        return new ScreenState(surfaceId, Instant.now(), List.of(), List.of(),
                warning == null ? List.of() : List.of(warning), List.of(), null);
    }

    public Optional<ScreenAnchor> anchor(String name) {
        return anchors.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    public Optional<ScreenElement> element(String name) {
        return elements.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public boolean allAnchorsFound() {
        return anchors.stream().allMatch(ScreenAnchor::found);
    }
}
