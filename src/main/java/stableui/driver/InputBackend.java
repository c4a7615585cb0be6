package stableui.driver;

/**
 * Low-level coordinate input, used when an action has to be performed on a
 * perceptual location. Coordinates are viewport pixels.
 */
public interface InputBackend {

    void moveTo(int x, int y);

    void click(int x, int y);

    /** Types into whatever currently has focus. */
    void typeText(String text);

    void pressEnter();

    void scroll(int dx, int dy);
}
