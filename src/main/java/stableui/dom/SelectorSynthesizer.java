package stableui.dom;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import stableui.model.SelectorStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Synthesizes a selector that re-locates an element through the structural driver.
 *
 * <p>Strategies in priority order:
 * <ol>
 *   <li>explicit identifier: {@code #id}, or {@code tag[id="…"]} when the id is not a
 *       plain CSS identifier</li>
 *   <li>tag plus up to three stable classes, accepted only if unique in the document</li>
 *   <li>XPath on text, accessibility label or placeholder, accepted only if unique</li>
 *   <li>{@code tag:nth-child(n)} path from the root</li>
 * </ol>
 * CSS selectors and XPath expressions are told apart by their first character:
 * XPath always starts with {@code /} or {@code (}.
 */
final class SelectorSynthesizer {

    private static final Pattern CSS_IDENT = Pattern.compile("-?[A-Za-z_][A-Za-z0-9_-]*");

    /** Classes produced by CSS-in-JS tooling or containing hash-like runs. */
    private static final Pattern GENERATED_CLASS = Pattern.compile(
            "^(css|sc|jsx|emotion|styled|svelte)-.*|.*\\d{3,}.*|^(?=(?:[a-z]*\\d){2})[a-z0-9]{6,}$");

    /** Classes that reflect transient UI state rather than identity. */
    private static final Pattern STATE_CLASS = Pattern.compile(
            "^(is-|has-)?(active|selected|hover|focus|focused|disabled|open|opened|show|hidden|visible|checked|expanded|collapsed)$");

    private static final int MAX_CLASSES    = 3;
    private static final int MAX_TEXT_CHARS = 80;

    /** A selector with the strategy that produced it. */
    record Synthesized(String selector, SelectorStrategy strategy) {}

    private SelectorSynthesizer() {}

    static Synthesized synthesize(Document doc, Element el, String label, String placeholder) {
        String tag = el.normalName();

        String id = el.id();
        if (!id.isBlank()) {
            if (CSS_IDENT.matcher(id).matches()) {
                return new Synthesized("#" + id, SelectorStrategy.ID);
            }
            if (!id.contains("\"")) {
                return new Synthesized(tag + "[id=\"" + id + "\"]", SelectorStrategy.ID);
            }
        }

        String byClass = classSelector(doc, el, tag);
        if (byClass != null) {
            return new Synthesized(byClass, SelectorStrategy.CLASS);
        }

        String byText = roleTextSelector(doc, el, tag, label, placeholder);
        if (byText != null) {
            return new Synthesized(byText, SelectorStrategy.ROLE_TEXT);
        }

        return new Synthesized(pathSelector(el), SelectorStrategy.PATH);
    }

    static boolean isXPath(String selector) {
        return selector.startsWith("/") || selector.startsWith("(");
    }

    static boolean isStableClass(String cls) {
        return CSS_IDENT.matcher(cls).matches()
                && !GENERATED_CLASS.matcher(cls).matches()
                && !STATE_CLASS.matcher(cls.toLowerCase(Locale.ROOT)).matches();
    }

    // ── Strategies ────────────────────────────────────────────────────────

    private static String classSelector(Document doc, Element el, String tag) {
        List<String> stable = new ArrayList<>();
        for (String cls : el.classNames()) {
            if (isStableClass(cls)) stable.add(cls);
            if (stable.size() == MAX_CLASSES) break;
        }
        StringBuilder sb = new StringBuilder(tag);
        for (String cls : stable) {
            sb.append('.').append(cls);
            String candidate = sb.toString();
            if (doc.select(candidate).size() == 1) {
                return candidate;
            }
        }
        return null;
    }

    private static String roleTextSelector(Document doc, Element el, String tag, String label, String placeholder) {
        String text = el.text();
        if (!text.isBlank() && text.length() <= MAX_TEXT_CHARS) {
            String literal = xpathLiteral(text);
            if (literal != null && countByText(doc, tag, text) == 1) {
                return "//" + tag + "[normalize-space(.)=" + literal + "]";
            }
        }
        String ariaLabel = el.attr("aria-label");
        if (!ariaLabel.isBlank() && ariaLabel.equals(label)) {
            String literal = xpathLiteral(ariaLabel);
            if (literal != null && countByAttr(doc, tag, "aria-label", ariaLabel) == 1) {
                return "//" + tag + "[@aria-label=" + literal + "]";
            }
        }
        if (placeholder != null && !placeholder.isBlank()) {
            String literal = xpathLiteral(placeholder);
            if (literal != null && countByAttr(doc, tag, "placeholder", placeholder) == 1) {
                return "//" + tag + "[@placeholder=" + literal + "]";
            }
        }
        return null;
    }

    private static String pathSelector(Element el) {
        List<String> parts = new ArrayList<>();
        Element current = el;
        while (current != null && !(current instanceof Document)) {
            String name = current.normalName();
            if (name.equals("html") || name.equals("body")) {
                parts.add(0, name);
            } else {
                parts.add(0, name + ":nth-child(" + (current.elementSiblingIndex() + 1) + ")");
            }
            current = current.parent();
        }
        return String.join(" > ", parts);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static long countByText(Document doc, String tag, String text) {
        return doc.getElementsByTag(tag).stream().filter(e -> e.text().equals(text)).count();
    }

    private static long countByAttr(Document doc, String tag, String attr, String value) {
        return doc.getElementsByAttributeValue(attr, value).stream()
                .filter(e -> e.normalName().equals(tag))
                .count();
    }

    /** Quotes a value for XPath 1.0; {@code null} when it contains both quote kinds. */
    private static String xpathLiteral(String value) {
        if (!value.contains("'")) return "'" + value + "'";
        if (!value.contains("\"")) return "\"" + value + "\"";
        return null;
    }
}
