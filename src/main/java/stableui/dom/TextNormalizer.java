package stableui.dom;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Text normalisation used for element matching.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE  = Pattern.compile("\\s+");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");

    private TextNormalizer() {}

    /** Trims and collapses whitespace, keeping case. */
    public static String collapse(String text) {
        if (text == null) return "";
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /** {@link #collapse} plus case folding. */
    public static String normalize(String text) {
        return collapse(text).toLowerCase(Locale.ROOT);
    }

    /** {@link #normalize} with punctuation removed; used for fuzzy matching. */
    public static String fuzzy(String text) {
        return collapse(PUNCTUATION.matcher(normalize(text)).replaceAll(" "));
    }
}
