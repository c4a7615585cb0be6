package stableui.controller;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import stableui.driver.DriverException;
import stableui.driver.StructuralDriver;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class OverlayDismisserTest {

    @Mock StructuralDriver driver;
    @Mock WebElement button;

    private AutoCloseable mocks;
    private OverlayDismisser dismisser;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        dismisser = new OverlayDismisser(driver, List.of("#accept", ".cookie-ok"));
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    public void dismiss_clicksFirstMatchingSelector() {
        when(driver.queryAll(".cookie-ok")).thenReturn(List.of(button));

        assertThat(dismisser.dismiss()).isEqualTo(".cookie-ok");
        verify(driver).click(button);
    }

    @Test
    public void dismiss_returnsNull_whenNothingMatches() {
        assertThat(dismisser.dismiss()).isNull();
        verify(driver, never()).click(any());
    }

    @Test
    public void dismiss_triesNextSelector_whenClickFails() {
        WebElement stale = mock(WebElement.class);
        when(driver.queryAll("#accept")).thenReturn(List.of(stale));
        doThrow(new DriverException(DriverException.Kind.EXECUTION, "stale element")).when(driver).click(stale);
        when(driver.queryAll(".cookie-ok")).thenReturn(List.of(button));

        assertThat(dismisser.dismiss()).isEqualTo(".cookie-ok");
    }

    @Test
    public void dismiss_skipsInvalidSelectors() {
        when(driver.queryAll("#accept"))
                .thenThrow(new DriverException(DriverException.Kind.INVALID_SELECTOR, "bad"));

        assertThat(dismisser.dismiss()).isNull();
    }
}
