package stableui.contract;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import stableui.config.EngineConfig;
import stableui.driver.InputBackend;
import stableui.driver.StructuralDriver;
import stableui.model.AnchorSpec;
import stableui.model.ScreenState;
import stableui.model.TargetSpec;
import stableui.vision.PerceptionBackend;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

public class SurfaceRegistryTest {

    @Mock StructuralDriver driver;
    @Mock PerceptionBackend perception;
    @Mock InputBackend input;

    private AutoCloseable mocks;
    private SurfaceRegistry registry;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(driver.getMarkup()).thenReturn("<html><body><button id=\"go\">Go</button></body></html>");
        registry = new SurfaceRegistry(EngineConfig.defaults());
    }

    @AfterMethod
    public void tearDown() throws Exception {
        registry.close();
        mocks.close();
    }

    @Test
    public void open_createsIndependentSessions() {
        SurfaceSession a = registry.open("a", driver, perception, input);
        SurfaceSession b = registry.open("b", driver, perception, input);

        assertThat(registry.surfaceIds()).containsExactlyInAnyOrder("a", "b");
        assertThat(a.getGate()).isNotSameAs(b.getGate());
        assertThat(a.getTracker()).isNotSameAs(b.getTracker());
        assertThat(a.getController().getSurfaceId()).isEqualTo("a");
    }

    @Test
    public void open_rejectsDuplicateId() {
        registry.open("a", driver, perception, input);

        assertThatThrownBy(() -> registry.open("a", driver, perception, input))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already open");
    }

    @Test
    public void require_rejectsUnknownSurface() {
        assertThatThrownBy(() -> registry.require("ghost"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown surface: ghost");
        assertThat(registry.isOpen(null)).isFalse();
    }

    @Test
    public void close_dropsSessionState() {
        SurfaceSession session = registry.open("a", driver, perception, input);
        ContractEngine engine = new ContractEngine(registry, EngineConfig.defaults());
        engine.analyzeState("a", List.of(AnchorSpec.text("go", "Go")), List.of(TargetSpec.bySelector("go", "#go")));
        assertThat(session.lastState()).isPresent();
        assertThat(session.knownTargets()).hasSize(1);

        registry.close("a");

        assertThat(registry.isOpen("a")).isFalse();
        assertThat(session.lastState()).isEmpty();
        assertThat(session.knownTargets()).isEmpty();
        assertThat(session.getGate().lastObservation()).isNull();
    }

    @Test
    public void close_ignoresUnknownSurface() {
        registry.close("never-opened");

        assertThat(registry.surfaceIds()).isEmpty();
    }

    @Test
    public void reopen_afterClose_startsFresh() {
        registry.open("a", driver, perception, input);
        registry.close("a");

        SurfaceSession again = registry.open("a", driver, perception, input);

        assertThat(again.lastState()).isEmpty();
        assertThat(again.getTracker().size()).isZero();
    }

    @Test
    public void targetSpec_sharpensRegisteredDescriptionWithSelector() {
        SurfaceSession session = registry.open("a", driver, perception, input);
        ContractEngine engine = new ContractEngine(registry, EngineConfig.defaults());
        ScreenState state = engine.analyzeState("a", List.of(), List.of(TargetSpec.byText("go", "Go")));

        TargetSpec spec = session.targetSpec("go", state);

        assertThat(spec.selector()).isEqualTo("#go");
        assertThat(spec.text()).isEqualTo("Go");
        assertThat(session.targetSpec("other", null)).isEqualTo(TargetSpec.named("other"));
    }
}
