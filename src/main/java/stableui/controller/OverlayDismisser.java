package stableui.controller;

import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.driver.DriverException;
import stableui.driver.StructuralDriver;

import java.util.List;

/**
 * Clears transient obstructions, typically consent banners, before the controller
 * acts on a surface.
 *
 * <p>Tries each configured dismiss-button selector in order and clicks the first
 * one that matches. Failures are logged at debug level and the next selector is
 * tried; dismissal never fails an action.
 */
public class OverlayDismisser {

    private static final Logger log = LoggerFactory.getLogger(OverlayDismisser.class);

    private final StructuralDriver driver;
    private final List<String> selectors;

    public OverlayDismisser(StructuralDriver driver, List<String> selectors) {
        this.driver = driver;
        this.selectors = List.copyOf(selectors);
    }

    /**
     * @return the selector that was clicked, or {@code null} if no overlay was found
     */
    public String dismiss() {
        for (String selector : selectors) {
            try {
                List<WebElement> matches = driver.queryAll(selector);
                if (matches.isEmpty()) continue;
                driver.click(matches.get(0));
                log.info("OverlayDismisser: dismissed overlay via '{}'", selector);
                return selector;
            } catch (DriverException e) {
                log.debug("OverlayDismisser: '{}' not usable ({}): {}", selector, e.getKind(), e.getMessage());
            }
        }
        return null;
    }

    public List<String> getSelectors() {
        return selectors;
    }
}
