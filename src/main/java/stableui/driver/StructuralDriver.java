package stableui.driver;

import org.openqa.selenium.WebElement;
import stableui.model.Region;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Structural access to a surface: selector queries, element actions and snapshots.
 * Every method reports failure as a {@link DriverException}.
 *
 * <p>Selectors starting with {@code /} or {@code (} are XPath; anything else is CSS.
 */
public interface StructuralDriver {

    List<WebElement> queryAll(String selector);

    void click(WebElement node);

    /** Replaces the node's value with {@code text}. */
    void fill(WebElement node, String text);

    void pressEnter(WebElement node);

    void scrollIntoView(WebElement node);

    void scrollBy(int dx, int dy);

    /** Current markup of the whole surface. */
    String getMarkup();

    /**
     * @param region region to capture, or {@code null} for the full viewport
     */
    BufferedImage screenshot(Region region);

    /** Current value of a form field, or its text for other elements. */
    String valueOf(WebElement node);

    /** Computed CSS property, e.g. {@code cursor}. */
    String cssValue(WebElement node, String property);

    /** URL or window title; {@code null} when the surface has none. */
    String location();
}
