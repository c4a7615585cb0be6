package stableui.dom;

import org.testng.annotations.Test;
import stableui.model.InteractiveElement;
import stableui.model.SelectorStrategy;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ElementIndexer} and {@link ElementIndex} lookups.
 * All markup is inline; no browser is involved.
 */
public class ElementIndexerTest {

    private final ElementIndexer indexer = new ElementIndexer();

    private static final String LOGIN_PAGE = """
            <html><body>
              <form>
                <label for="email">Email address</label>
                <input id="email" type="email" placeholder="you@example.com">
                <input type="password" aria-label="Password">
                <input type="hidden" name="csrf" value="x">
                <button id="login" class="btn primary">Sign in</button>
                <a href="/forgot">Forgot password?</a>
                <div role="button" onclick="help()">Help</div>
                <span>Not interactive</span>
              </form>
            </body></html>
            """;

    // ── Qualification ─────────────────────────────────────────────────────

    @Test
    public void parse_returnsInteractiveElementsInDocumentOrder() {
        List<InteractiveElement> elements = indexer.parse(LOGIN_PAGE);

        assertThat(elements).extracting(InteractiveElement::tag)
                .containsExactly("input", "input", "button", "a", "div");
    }

    @Test
    public void parse_skipsHiddenElements() {
        String html = """
                <body>
                  <button hidden>Ghost</button>
                  <div style="display: none"><button>Inside hidden</button></div>
                  <button aria-hidden="true">Aria hidden</button>
                  <button>Shown</button>
                </body>
                """;

        assertThat(indexer.parse(html)).extracting(InteractiveElement::text).containsExactly("Shown");
    }

    @Test
    public void parse_returnsEmpty_forNullMarkup() {
        assertThat(indexer.parse(null)).isEmpty();
    }

    // ── Extraction ────────────────────────────────────────────────────────

    @Test
    public void parse_derivesRolesAndLabels() {
        List<InteractiveElement> elements = indexer.parse(LOGIN_PAGE);

        InteractiveElement email = elements.get(0);
        assertThat(email.role()).isEqualTo("textbox");
        assertThat(email.ariaLabel()).isEqualTo("Email address");
        assertThat(email.placeholder()).isEqualTo("you@example.com");

        assertThat(elements.get(1).ariaLabel()).isEqualTo("Password");
        assertThat(elements.get(3).role()).isEqualTo("link");
        assertThat(elements.get(4).role()).isEqualTo("button");
    }

    @Test
    public void parse_prefersIdOverClassSelector() {
        InteractiveElement login = indexer.parse(LOGIN_PAGE).get(2);

        assertThat(login.id()).isEqualTo("login");
        assertThat(login.selector()).isEqualTo("#login");
        assertThat(login.selectorStrategy()).isEqualTo(SelectorStrategy.ID);
        assertThat(login.confidence()).isEqualTo(1.0);
    }

    @Test
    public void parse_usesStableClass_whenNoId() {
        String html = "<body><button class=\"css-1x2y3z active checkout\">Pay</button>"
                + "<button class=\"other\">Cancel</button></body>";

        InteractiveElement pay = indexer.parse(html).get(0);

        assertThat(pay.selector()).isEqualTo("button.checkout");
        assertThat(pay.selectorStrategy()).isEqualTo(SelectorStrategy.CLASS);
        assertThat(pay.id()).isEqualTo("e0");
    }

    @Test
    public void parse_fallsBackToTextXPath_whenClassesAreNotUnique() {
        String html = "<body><button class=\"btn\">Save</button><button class=\"btn\">Delete</button></body>";

        InteractiveElement delete = indexer.parse(html).get(1);

        assertThat(delete.selector()).isEqualTo("//button[normalize-space(.)='Delete']");
        assertThat(delete.selectorStrategy()).isEqualTo(SelectorStrategy.ROLE_TEXT);
    }

    @Test
    public void parse_fallsBackToPath_whenNothingIsUnique() {
        String html = "<body><div><a href=\"#\">More</a></div><div><a href=\"#\">More</a></div></body>";

        InteractiveElement second = indexer.parse(html).get(1);

        assertThat(second.selector()).isEqualTo("html > body > div:nth-child(2) > a:nth-child(1)");
        assertThat(second.selectorStrategy()).isEqualTo(SelectorStrategy.PATH);
    }

    @Test
    public void parse_truncatesLongText() {
        String html = "<body><button>" + "x".repeat(500) + "</button></body>";

        assertThat(indexer.parse(html).get(0).text()).hasSize(200);
    }

    // ── Index ─────────────────────────────────────────────────────────────

    @Test
    public void findByText_isCaseSensitive_unlessFuzzy() {
        ElementIndex index = indexer.index(LOGIN_PAGE);

        assertThat(index.findByText("sign in")).isEmpty();
        assertThat(index.findByText("Sign in")).hasSize(1);
        assertThat(index.findByText("sign in", true)).hasSize(1);
        assertThat(index.findByText("forgot password", true)).hasSize(1);
    }

    @Test
    public void findByText_matchesLabelsAndPlaceholders() {
        ElementIndex index = indexer.index(LOGIN_PAGE);

        assertThat(index.findByText("Password")).extracting(InteractiveElement::tag)
                .containsExactly("input");
        assertThat(index.findByText("password", true)).extracting(InteractiveElement::tag)
                .containsExactly("input", "a");
        assertThat(index.findByText("you@example")).hasSize(1);
    }

    @Test
    public void findByRoleTagAndSelector_locateElements() {
        ElementIndex index = indexer.index(LOGIN_PAGE);

        assertThat(index.findByRole("BUTTON")).hasSize(2);
        assertThat(index.findByTag("input")).hasSize(2);
        assertThat(index.findBySelector("#login"))
                .hasValueSatisfying(e -> assertThat(e.text()).isEqualTo("Sign in"));
        assertThat(index.findBySelector("#nope")).isEmpty();
    }

    @Test
    public void index_detectsOverlayAndModal() {
        String html = "<body><div id=\"onetrust-banner-sdk\"><button>Accept</button></div>"
                + "<div role=\"dialog\">Hi</div></body>";

        ElementIndex index = indexer.index(html);

        assertThat(index.overlayPresent()).isTrue();
        assertThat(index.modalPresent()).isTrue();
        assertThat(indexer.index(LOGIN_PAGE).overlayPresent()).isFalse();
    }

    @Test
    public void containsText_ignoresCase() {
        ElementIndex index = indexer.index(LOGIN_PAGE);

        assertThat(index.containsText("NOT INTERACTIVE")).isTrue();
        assertThat(index.containsText("welcome back")).isFalse();
    }

    @Test
    public void structuralHash_ignoresScriptsAndComments() {
        String plain = "<body><button>Go</button></body>";
        String noisy = "<body><button>Go</button><script>var t = Date.now();</script><!-- build 42 --></body>";

        assertThat(indexer.structuralHash(noisy)).isEqualTo(indexer.structuralHash(plain));
        assertThat(indexer.structuralHash("<body><button>Stop</button></body>"))
                .isNotEqualTo(indexer.structuralHash(plain));
    }

    @Test
    public void describe_includesNameRoleAndSelector() {
        InteractiveElement link = indexer.parse(LOGIN_PAGE).get(3);

        assertThat(ElementIndex.describe(link)).startsWith("a 'Forgot password?' role=link [");
    }
}
