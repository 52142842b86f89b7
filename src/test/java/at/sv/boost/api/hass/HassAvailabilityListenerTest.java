package at.sv.boost.api.hass;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class HassAvailabilityListenerTest {

    private Runnable onRestarted;
    private HassAvailabilityListener listener;

    @BeforeEach
    void setUp() {
        onRestarted = mock(Runnable.class);
        listener = new HassAvailabilityListener(onRestarted);
    }

    @Test
    void firstStart_notARestart() {
        listener.onStarted();

        assertThat(listener.isFullyStarted()).isTrue();
        verifyNoInteractions(onRestarted);
    }

    @Test
    void everyFurtherStart_isReportedAsRestart() {
        listener.onStarted();
        listener.onStarted();
        listener.onStarted();

        verify(onRestarted, times(2)).run();
    }

    @Test
    void probe_repeatedUntilSuccessful() {
        AtomicInteger probes = new AtomicInteger();

        assertThat(listener.probeStarted(() -> probes.incrementAndGet() > 1)).isFalse();
        assertThat(listener.probeStarted(() -> probes.incrementAndGet() > 1)).isTrue();
        assertThat(listener.probeStarted(() -> probes.incrementAndGet() > 100)).isTrue();

        assertThat(probes).hasValue(2);
    }

    @Test
    void startAfterSuccessfulProbe_isRestart() {
        listener.probeStarted(() -> true);

        listener.onStarted();

        verify(onRestarted).run();
    }

    @Test
    void startEvent_skipsProbe() {
        listener.onStarted();

        assertThat(listener.probeStarted(() -> {
            throw new AssertionError("not expected");
        })).isTrue();
    }
}
