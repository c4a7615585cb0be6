package stableui.dom;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.model.InteractiveElement;
import stableui.util.ContentHash;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parses a markup snapshot into the flat list of interactable elements, each with
 * a synthesized selector.
 *
 * <p>An element qualifies when its tag or explicit role is on the allow-list, or
 * when it carries an inline interaction handler. Hidden elements (the {@code hidden}
 * attribute, {@code aria-hidden="true"}, inline {@code display:none} or
 * {@code visibility:hidden} on the element or an ancestor, and
 * {@code input[type=hidden]}) are skipped.
 *
 * <p>Stateless; a single instance may be shared across threads and surfaces.
 */
public class ElementIndexer {

    private static final Logger log = LoggerFactory.getLogger(ElementIndexer.class);

    static final Set<String> INTERACTIVE_TAGS = Set.of(
            "button", "a", "input", "select", "textarea", "option", "summary", "details");

    static final Set<String> INTERACTIVE_ROLES = Set.of(
            "button", "link", "textbox", "searchbox", "combobox", "checkbox",
            "radio", "menuitem", "tab", "switch");

    private static final Set<String> AFFORDANCE_ATTRS = Set.of("onclick", "ng-click");

    private static final Map<String, String> INPUT_ROLES = Map.ofEntries(
            Map.entry("text", "textbox"), Map.entry("email", "textbox"),
            Map.entry("password", "textbox"), Map.entry("number", "textbox"),
            Map.entry("tel", "textbox"), Map.entry("url", "textbox"),
            Map.entry("search", "searchbox"), Map.entry("checkbox", "checkbox"),
            Map.entry("radio", "radio"), Map.entry("submit", "button"),
            Map.entry("button", "button"), Map.entry("reset", "button"),
            Map.entry("image", "button"), Map.entry("range", "slider"));

    /** Modal dialog markers. */
    private static final String MODAL_QUERY = String.join(",",
            "dialog[open]",
            "[role=dialog]:not([aria-hidden=true])",
            "[role=alertdialog]",
            "[aria-modal=true]",
            ".modal.show",
            ".modal.in");

    /** Consent and cookie banner containers. */
    private static final String OVERLAY_QUERY = String.join(",",
            "#onetrust-banner-sdk",
            "#CybotCookiebotDialog",
            "#usercentrics-root",
            "[id*=cookie-banner]",
            "[class*=cookie-banner]",
            "[class*=consent-banner]",
            "[aria-label*=cookie]");

    private static final int MAX_TEXT_CHARS = 200;

    /**
     * Parses {@code markup} and returns its interactive elements in document order.
     */
    public List<InteractiveElement> parse(String markup) {
        return index(markup).elements();
    }

    /**
     * Parses {@code markup} into an {@link ElementIndex}: elements plus the
     * structural hash, visible text and overlay/modal markers of the snapshot.
     */
    public ElementIndex index(String markup) {
        String source = markup == null ? "" : markup;
        Document doc = Jsoup.parse(source);

        List<InteractiveElement> elements = new ArrayList<>();
        int ordinal = 0;
        for (Element el : doc.body().getAllElements()) {
            if (!isInteractive(el) || isHidden(el)) continue;
            elements.add(toElement(doc, el, ordinal++));
        }

        boolean modal   = !doc.select(MODAL_QUERY).isEmpty();
        boolean overlay = !doc.select(OVERLAY_QUERY).isEmpty();
        String hash = structuralHash(doc);
        String visibleText = doc.body().text();

        log.debug("ElementIndexer: {} interactive elements, hash={}, modal={}, overlay={}",
                elements.size(), hash, modal, overlay);
        return new ElementIndex(elements, hash, visibleText, overlay, modal);
    }

    /** Content hash of the markup with script, style and comment content removed. */
    public String structuralHash(String markup) {
        return structuralHash(Jsoup.parse(markup == null ? "" : markup));
    }

    // ── Qualification ─────────────────────────────────────────────────────

    static boolean isInteractive(Element el) {
        if (INTERACTIVE_TAGS.contains(el.normalName())) return true;
        String role = el.attr("role").trim().toLowerCase(Locale.ROOT);
        if (INTERACTIVE_ROLES.contains(role)) return true;
        for (String attr : AFFORDANCE_ATTRS) {
            if (el.hasAttr(attr)) return true;
        }
        return false;
    }

    static boolean isHidden(Element el) {
        if (el.normalName().equals("input") && "hidden".equalsIgnoreCase(el.attr("type"))) return true;
        for (Element e = el; e != null; e = e.parent()) {
            if (e.hasAttr("hidden") || "true".equalsIgnoreCase(e.attr("aria-hidden"))) return true;
            String style = e.attr("style").replace(" ", "").toLowerCase(Locale.ROOT);
            if (style.contains("display:none") || style.contains("visibility:hidden")) return true;
        }
        return false;
    }

    // ── Extraction ────────────────────────────────────────────────────────

    private InteractiveElement toElement(Document doc, Element el, int ordinal) {
        String tag = el.normalName();
        String text = TextNormalizer.collapse(displayText(el));
        if (text.length() > MAX_TEXT_CHARS) text = text.substring(0, MAX_TEXT_CHARS);
        String label = accessibleLabel(doc, el);
        String placeholder = el.hasAttr("placeholder") ? el.attr("placeholder") : null;

        SelectorSynthesizer.Synthesized sel = SelectorSynthesizer.synthesize(doc, el, label, placeholder);
        String id = el.id().isBlank() ? "e" + ordinal : el.id();

        return InteractiveElement.structural(id, tag, roleOf(el), text, TextNormalizer.normalize(text),
                label, placeholder, sel.selector(), sel.strategy());
    }

    private static String displayText(Element el) {
        if (el.normalName().equals("input")) {
            String type = el.attr("type").toLowerCase(Locale.ROOT);
            if (type.equals("submit") || type.equals("button") || type.equals("reset")) {
                return el.attr("value");
            }
            return "";
        }
        return el.text();
    }

    static String roleOf(Element el) {
        String explicit = el.attr("role").trim().toLowerCase(Locale.ROOT);
        if (!explicit.isEmpty()) return explicit;
        return switch (el.normalName()) {
            case "button", "summary" -> "button";
            case "a"        -> "link";
            case "select"   -> "combobox";
            case "textarea" -> "textbox";
            case "option"   -> "option";
            case "details"  -> "group";
            case "input" -> {
                String type = el.attr("type").trim().toLowerCase(Locale.ROOT);
                yield INPUT_ROLES.getOrDefault(type.isEmpty() ? "text" : type, "textbox");
            }
            default -> "generic";
        };
    }

    /**
     * {@code aria-label}, then {@code aria-labelledby}, then an associated or
     * wrapping {@code <label>}, then {@code title}; {@code null} if none.
     */
    static String accessibleLabel(Document doc, Element el) {
        String aria = el.attr("aria-label").trim();
        if (!aria.isEmpty()) return aria;

        String labelledBy = el.attr("aria-labelledby").trim();
        if (!labelledBy.isEmpty()) {
            StringBuilder sb = new StringBuilder();
            for (String ref : labelledBy.split("\\s+")) {
                Element target = doc.getElementById(ref);
                if (target != null) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(target.text());
                }
            }
            if (sb.length() > 0) return TextNormalizer.collapse(sb.toString());
        }

        if (!el.id().isBlank()) {
            for (Element label : doc.getElementsByTag("label")) {
                if (el.id().equals(label.attr("for")) && !label.text().isBlank()) {
                    return label.text();
                }
            }
        }
        Element wrapping = el.closest("label");
        if (wrapping != null && wrapping != el && !wrapping.text().isBlank()) {
            return wrapping.text();
        }

        String title = el.attr("title").trim();
        return title.isEmpty() ? null : title;
    }

    private static String structuralHash(Document doc) {
        Document copy = doc.clone();
        copy.select("script, style, noscript").remove();
        copy.getAllElements().forEach(e -> e.childNodes().stream()
                .filter(n -> n instanceof Comment)
                .toList()
                .forEach(Node::remove));
        return ContentHash.of(copy.outerHtml());
    }
}
