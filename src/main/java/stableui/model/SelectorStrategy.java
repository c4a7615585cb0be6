package stableui.model;

/**
 * How a synthesized selector re-locates its element, in priority order.
 */
public enum SelectorStrategy {
    /** {@code #id} or {@code tag[id="…"]}. */
    ID,
    /** Tag plus a combination of stable class names, unique in the document. */
    CLASS,
    /** XPath over role (explicit or implied by the tag) and visible text or label. */
    ROLE_TEXT,
    /** {@code tag:nth-child(n)} chain from the root. */
    PATH,
    /** Not synthesized here: perceived (no selector) or supplied verbatim by the caller. */
    NONE
}
