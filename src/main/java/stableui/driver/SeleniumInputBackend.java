package stableui.driver;

import org.openqa.selenium.Keys;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.interactions.Actions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InputBackend} built on W3C Actions: pointer moves and clicks at viewport
 * coordinates, keyboard input to the focused element, and wheel scrolling.
 */
public class SeleniumInputBackend implements InputBackend {

    private static final Logger log = LoggerFactory.getLogger(SeleniumInputBackend.class);

    private final WebDriver driver;

    public SeleniumInputBackend(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void moveTo(int x, int y) {
        perform("moveTo", actions().moveToLocation(x, y));
    }

    @Override
    public void click(int x, int y) {
        log.debug("SeleniumInputBackend: click at ({}, {})", x, y);
        perform("click", actions().moveToLocation(x, y).click());
    }

    @Override
    public void typeText(String text) {
        perform("typeText", actions().sendKeys(text));
    }

    @Override
    public void pressEnter() {
        perform("pressEnter", actions().sendKeys(Keys.ENTER));
    }

    @Override
    public void scroll(int dx, int dy) {
        perform("scroll", actions().scrollByAmount(dx, dy));
    }

    /** Fresh builder per gesture; {@link Actions} accumulates state. */
    Actions actions() {
        return new Actions(driver);
    }

    private void perform(String what, Actions actions) {
        try {
            actions.perform();
        } catch (WebDriverException e) {
            throw new DriverException(DriverException.Kind.EXECUTION, what + " failed: " + e.getMessage(), e);
        }
    }
}
