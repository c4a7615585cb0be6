package stableui.state;

import java.util.List;
import java.util.Objects;

/**
 * Difference between two observations of the same surface.
 *
 * @param added              selectors present only in the newer observation
 * @param removed            selectors present only in the older observation
 * @param hashChanged        structural hashes differ
 * @param locationChanged    location (URL or title) differs
 * @param overlayAppeared    a dismissible overlay appeared
 * @param overlayDisappeared a dismissible overlay went away
 * @param modalAppeared      a modal dialog appeared
 * @param modalDisappeared   a modal dialog went away
 */
public record StateDiff(
        List<String> added,
        List<String> removed,
        boolean hashChanged,
        boolean locationChanged,
        boolean overlayAppeared,
        boolean overlayDisappeared,
        boolean modalAppeared,
        boolean modalDisappeared) {

    public StateDiff {
        added   = List.copyOf(Objects.requireNonNull(added, "added"));
        removed = List.copyOf(Objects.requireNonNull(removed, "removed"));
    }

    /** Whether the change is one a caller should react to: anything but identical structure. */
    public boolean hasSignificantChange() {
        return hashChanged || locationChanged || !added.isEmpty() || !removed.isEmpty()
                || overlayAppeared || overlayDisappeared || modalAppeared || modalDisappeared;
    }

    /** Whether the selector sets differ. */
    public boolean elementsChanged() {
        return !added.isEmpty() || !removed.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("StateDiff{+%d -%d hash=%s location=%s overlay=%s modal=%s}",
                added.size(), removed.size(), hashChanged, locationChanged,
                overlayAppeared ? "appeared" : overlayDisappeared ? "gone" : "same",
                modalAppeared ? "appeared" : modalDisappeared ? "gone" : "same");
    }
}
