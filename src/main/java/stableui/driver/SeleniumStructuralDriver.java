package stableui.driver;

import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Keys;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stableui.model.Region;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * {@link StructuralDriver} over a Selenium {@link WebDriver}.
 *
 * <p>Selenium exceptions are translated at this boundary: invalid selectors to
 * {@link DriverException.Kind#INVALID_SELECTOR}, timeouts to
 * {@link DriverException.Kind#TIMEOUT}, everything else to
 * {@link DriverException.Kind#EXECUTION}.
 */
public class SeleniumStructuralDriver implements StructuralDriver {

    private static final Logger log = LoggerFactory.getLogger(SeleniumStructuralDriver.class);

    private final WebDriver driver;

    public SeleniumStructuralDriver(WebDriver driver) {
        this.driver = driver;
    }

    /**
     * Converts a selector string to a Selenium {@link By}.
     */
    public static By toBy(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new DriverException(DriverException.Kind.INVALID_SELECTOR, "Selector must not be blank");
        }
        String s = selector.trim();
        return s.startsWith("/") || s.startsWith("(") ? By.xpath(s) : By.cssSelector(s);
    }

    @Override
    public List<WebElement> queryAll(String selector) {
        By by = toBy(selector);
        return call("queryAll " + selector, () -> driver.findElements(by));
    }

    @Override
    public void click(WebElement node) {
        run("click", node::click);
    }

    @Override
    public void fill(WebElement node, String text) {
        run("fill", () -> {
            node.clear();
            node.sendKeys(text);
        });
    }

    @Override
    public void pressEnter(WebElement node) {
        run("pressEnter", () -> node.sendKeys(Keys.ENTER));
    }

    @Override
    public void scrollIntoView(WebElement node) {
        run("scrollIntoView", () -> ((JavascriptExecutor) driver).executeScript(
                "arguments[0].scrollIntoView({block: 'center', inline: 'nearest'});", node));
    }

    @Override
    public void scrollBy(int dx, int dy) {
        run("scrollBy", () -> ((JavascriptExecutor) driver).executeScript(
                "window.scrollBy(arguments[0], arguments[1]);", dx, dy));
    }

    @Override
    public String getMarkup() {
        try {
            String source = driver.getPageSource();
            if (source == null) {
                throw new DriverException(DriverException.Kind.CAPTURE, "Driver returned no page source");
            }
            return source;
        } catch (WebDriverException e) {
            throw new DriverException(DriverException.Kind.CAPTURE, "getMarkup failed: " + e.getMessage(), e);
        }
    }

    @Override
    public BufferedImage screenshot(Region region) {
        byte[] png;
        try {
            png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
        } catch (WebDriverException | ClassCastException e) {
            throw new DriverException(DriverException.Kind.CAPTURE, "screenshot failed: " + e.getMessage(), e);
        }
        BufferedImage full;
        try {
            full = ImageIO.read(new ByteArrayInputStream(png));
        } catch (IOException e) {
            throw new DriverException(DriverException.Kind.CAPTURE, "screenshot not decodable", e);
        }
        if (full == null) {
            throw new DriverException(DriverException.Kind.CAPTURE, "screenshot not decodable");
        }
        return crop(full, region);
    }

    @Override
    public String valueOf(WebElement node) {
        return call("valueOf", () -> {
            String tag = node.getTagName() == null ? "" : node.getTagName().toLowerCase(Locale.ROOT);
            if (tag.equals("input") || tag.equals("textarea") || tag.equals("select")) {
                String value = node.getDomProperty("value");
                return value == null ? "" : value;
            }
            return node.getText();
        });
    }

    @Override
    public String cssValue(WebElement node, String property) {
        return call("cssValue " + property, () -> node.getCssValue(property));
    }

    @Override
    public String location() {
        try {
            return driver.getCurrentUrl();
        } catch (WebDriverException e) {
            log.debug("SeleniumStructuralDriver: current URL unavailable: {}", e.getMessage());
            return null;
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** Crops {@code image} to {@code region}, clamped to the image bounds. */
    static BufferedImage crop(BufferedImage image, Region region) {
        if (region == null) return image;
        int x = Math.min(region.x(), image.getWidth() - 1);
        int y = Math.min(region.y(), image.getHeight() - 1);
        int w = Math.min(region.width(), image.getWidth() - x);
        int h = Math.min(region.height(), image.getHeight() - y);
        return image.getSubimage(x, y, w, h);
    }

    private void run(String what, Runnable action) {
        call(what, () -> {
            action.run();
            return null;
        });
    }

    private <T> T call(String what, Supplier<T> action) {
        try {
            return action.get();
        } catch (InvalidSelectorException e) {
            throw new DriverException(DriverException.Kind.INVALID_SELECTOR, what + ": " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new DriverException(DriverException.Kind.TIMEOUT, what + " timed out", e);
        } catch (WebDriverException e) {
            throw new DriverException(DriverException.Kind.EXECUTION, what + " failed: " + e.getMessage(), e);
        }
    }
}
