package stableui.driver;

import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.InvalidSelectorException;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import stableui.model.Region;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class SeleniumStructuralDriverTest {

    @Mock WebElement node;

    private AutoCloseable mocks;
    private WebDriver webDriver;
    private SeleniumStructuralDriver driver;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        webDriver = mock(WebDriver.class, withSettings().extraInterfaces(TakesScreenshot.class));
        driver = new SeleniumStructuralDriver(webDriver);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    // ── Selectors ─────────────────────────────────────────────────────────

    @Test
    public void toBy_treatsSlashAndParenAsXPath() {
        assertThat(SeleniumStructuralDriver.toBy("//button[text()='OK']")).isEqualTo(By.xpath("//button[text()='OK']"));
        assertThat(SeleniumStructuralDriver.toBy("(//a)[2]")).isEqualTo(By.xpath("(//a)[2]"));
        assertThat(SeleniumStructuralDriver.toBy(" #submit ")).isEqualTo(By.cssSelector("#submit"));
    }

    @Test
    public void toBy_rejectsBlankSelector() {
        assertThatThrownBy(() -> SeleniumStructuralDriver.toBy("  "))
                .isInstanceOfSatisfying(DriverException.class,
                        e -> assertThat(e.getKind()).isEqualTo(DriverException.Kind.INVALID_SELECTOR));
    }

    @Test
    public void queryAll_translatesInvalidSelector() {
        when(webDriver.findElements(any(By.class))).thenThrow(new InvalidSelectorException("bad css"));

        assertThatThrownBy(() -> driver.queryAll("div[[["))
                .isInstanceOfSatisfying(DriverException.class,
                        e -> assertThat(e.getKind()).isEqualTo(DriverException.Kind.INVALID_SELECTOR));
    }

    @Test
    public void queryAll_returnsMatches() {
        when(webDriver.findElements(By.cssSelector("#ok"))).thenReturn(List.of(node));

        assertThat(driver.queryAll("#ok")).containsExactly(node);
    }

    // ── Actions ───────────────────────────────────────────────────────────

    @Test
    public void click_translatesSeleniumFailures() {
        doThrow(new StaleElementReferenceException("detached")).when(node).click();

        assertThatThrownBy(() -> driver.click(node))
                .isInstanceOfSatisfying(DriverException.class,
                        e -> assertThat(e.getKind()).isEqualTo(DriverException.Kind.EXECUTION));
    }

    @Test
    public void click_translatesTimeouts() {
        doThrow(new TimeoutException("slow")).when(node).click();

        assertThatThrownBy(() -> driver.click(node))
                .isInstanceOfSatisfying(DriverException.class,
                        e -> assertThat(e.getKind()).isEqualTo(DriverException.Kind.TIMEOUT));
    }

    @Test
    public void fill_clearsThenTypes() {
        driver.fill(node, "ada@example.com");

        InOrder order = inOrder(node);
        order.verify(node).clear();
        order.verify(node).sendKeys("ada@example.com");
    }

    // ── Reads ─────────────────────────────────────────────────────────────

    @Test
    public void valueOf_readsValuePropertyForFormFields() {
        when(node.getTagName()).thenReturn("INPUT");
        when(node.getDomProperty("value")).thenReturn("42");

        assertThat(driver.valueOf(node)).isEqualTo("42");
    }

    @Test
    public void valueOf_readsTextForOtherElements() {
        when(node.getTagName()).thenReturn("span");
        when(node.getText()).thenReturn("Total");

        assertThat(driver.valueOf(node)).isEqualTo("Total");
    }

    @Test
    public void getMarkup_failsAsCapture_whenSourceMissing() {
        when(webDriver.getPageSource()).thenReturn(null);

        assertThatThrownBy(() -> driver.getMarkup())
                .isInstanceOfSatisfying(DriverException.class,
                        e -> assertThat(e.getKind()).isEqualTo(DriverException.Kind.CAPTURE));
    }

    @Test
    public void location_isNull_whenDriverCannotAnswer() {
        when(webDriver.getCurrentUrl()).thenThrow(new WebDriverException("no window"));

        assertThat(driver.location()).isNull();
    }

    // ── Screenshots ───────────────────────────────────────────────────────

    @Test
    public void screenshot_decodesAndCrops() throws Exception {
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(200, 100, BufferedImage.TYPE_INT_RGB), "png", png);
        when(((TakesScreenshot) webDriver).getScreenshotAs(OutputType.BYTES)).thenReturn(png.toByteArray());

        BufferedImage full = driver.screenshot(null);
        BufferedImage part = driver.screenshot(new Region(150, 50, 100, 100));

        assertThat(full.getWidth()).isEqualTo(200);
        assertThat(part.getWidth()).isEqualTo(50);
        assertThat(part.getHeight()).isEqualTo(50);
    }

    @Test
    public void screenshot_failsAsCapture_whenBytesAreNotAnImage() {
        when(((TakesScreenshot) webDriver).getScreenshotAs(OutputType.BYTES)).thenReturn(new byte[]{1, 2, 3});

        assertThatThrownBy(() -> driver.screenshot(null))
                .isInstanceOfSatisfying(DriverException.class,
                        e -> assertThat(e.getKind()).isEqualTo(DriverException.Kind.CAPTURE));
    }
}
