package stableui.dom;

import stableui.model.InteractiveElement;
import stableui.model.SurfaceFlags;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result set of one {@link ElementIndexer#index} call. Immutable.
 */
public final class ElementIndex {

    private final List<InteractiveElement> elements;
    private final String structuralHash;
    private final String visibleText;
    private final boolean overlayPresent;
    private final boolean modalPresent;

    ElementIndex(List<InteractiveElement> elements, String structuralHash, String visibleText,
                 boolean overlayPresent, boolean modalPresent) {
        this.elements       = List.copyOf(elements);
        this.structuralHash = structuralHash;
        this.visibleText    = visibleText == null ? "" : visibleText;
        this.overlayPresent = overlayPresent;
        this.modalPresent   = modalPresent;
    }

    /** An index with no elements, for surfaces whose markup could not be read. */
    public static ElementIndex empty() {
        return new ElementIndex(List.of(), "", "", false, false);
    }

    public List<InteractiveElement> elements() { return elements; }
    public String  structuralHash()            { return structuralHash; }
    public String  visibleText()               { return visibleText; }
    public boolean overlayPresent()            { return overlayPresent; }
    public boolean modalPresent()              { return modalPresent; }
    public int     size()                      { return elements.size(); }

    /** Selectors of every indexed element, in document order. */
    public List<String> selectors() {
        return elements.stream()
                .filter(InteractiveElement::hasSelector)
                .map(InteractiveElement::selector)
                .toList();
    }

    public SurfaceFlags flags(String location) {
        return new SurfaceFlags(overlayPresent, modalPresent, location);
    }

    // ── Lookups ───────────────────────────────────────────────────────────

    /** Exact (case-sensitive, whitespace-collapsed) substring match. */
    public List<InteractiveElement> findByText(String query) {
        return findByText(query, false);
    }

    /**
     * Matches {@code query} as a substring of each element's text, accessibility
     * label or placeholder. Fuzzy mode ignores case and punctuation.
     */
    public List<InteractiveElement> findByText(String query, boolean fuzzy) {
        if (query == null || query.isBlank()) return List.of();
        Function<String, String> form = fuzzy ? TextNormalizer::fuzzy : TextNormalizer::collapse;
        String needle = form.apply(query);
        if (needle.isEmpty()) return List.of();
        return elements.stream()
                .filter(e -> contains(form, e.text(), needle)
                        || contains(form, e.ariaLabel(), needle)
                        || contains(form, e.placeholder(), needle))
                .toList();
    }

    public List<InteractiveElement> findByRole(String role) {
        if (role == null) return List.of();
        String wanted = role.trim().toLowerCase(Locale.ROOT);
        return elements.stream().filter(e -> wanted.equals(e.role())).toList();
    }

    public List<InteractiveElement> findByTag(String tag) {
        if (tag == null) return List.of();
        String wanted = tag.trim().toLowerCase(Locale.ROOT);
        return elements.stream().filter(e -> wanted.equals(e.tag())).toList();
    }

    /** Element whose synthesized selector equals {@code selector}. */
    public Optional<InteractiveElement> findBySelector(String selector) {
        if (selector == null) return Optional.empty();
        return elements.stream().filter(e -> selector.equals(e.selector())).findFirst();
    }

    /** Whether the snapshot's visible text contains {@code text}, ignoring case. */
    public boolean containsText(String text) {
        if (text == null || text.isBlank()) return false;
        return TextNormalizer.normalize(visibleText).contains(TextNormalizer.normalize(text));
    }

    /** One-line human-readable description, e.g. {@code button 'Sign in' [#login]}. */
    public static String describe(InteractiveElement e) {
        StringBuilder sb = new StringBuilder(e.tag().isEmpty() ? e.role() : e.tag());
        String name = e.displayName();
        if (!name.isBlank()) sb.append(" '").append(name).append('\'');
        if (e.role() != null && !e.role().equals(e.tag())) sb.append(" role=").append(e.role());
        if (e.hasSelector()) sb.append(" [").append(e.selector()).append(']');
        return sb.toString();
    }

    private static boolean contains(Function<String, String> form, String haystack, String needle) {
        return haystack != null && form.apply(haystack).contains(needle);
    }
}
