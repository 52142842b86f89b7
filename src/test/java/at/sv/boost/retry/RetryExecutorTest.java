package at.sv.boost.retry;

import at.sv.boost.TestTaskScheduler;
import at.sv.boost.api.HomeAssistantApi;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RetryExecutorTest {

    private static final String SWITCH = "switch.schedule_a";

    private Instant now;
    private HomeAssistantApi api;
    private TestTaskScheduler scheduler;
    private RetryExecutor retryExecutor;
    private List<String> actions;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2024-01-10T10:00:00Z");
        api = mock(HomeAssistantApi.class);
        scheduler = new TestTaskScheduler(() -> now);
        retryExecutor = new RetryExecutor(api, scheduler, Runnable::run, new RetryPolicy(3, Duration.ofSeconds(10)));
        actions = new ArrayList<>();
    }

    private void advanceTimeAndRunDueTasks() {
        now = now.plusSeconds(10);
        scheduler.runDueTasks();
    }

    @Test
    void available_runsImmediately() {
        when(api.isAvailable(SWITCH)).thenReturn(true);

        RetryAttempt attempt = retryExecutor.attempt("turn off", SWITCH, () -> actions.add("off"));

        assertThat(attempt.future()).isCompletedWithValue(true);
        assertThat(actions).containsExactly("off");
        assertThat(scheduler.getScheduledTasks()).isEmpty();
    }

    @Test
    void unavailable_retriedAfterDelay() {
        when(api.isAvailable(SWITCH)).thenReturn(false);
        RetryAttempt attempt = retryExecutor.attempt("turn off", SWITCH, () -> actions.add("off"));

        assertThat(attempt.future()).isNotDone();
        assertThat(scheduler.getScheduledTasks()).extracting(TestTaskScheduler.ScheduledTask::due)
                                                 .containsExactly(now.plusSeconds(10));

        when(api.isAvailable(SWITCH)).thenReturn(true);
        advanceTimeAndRunDueTasks();

        assertThat(attempt.future()).isCompletedWithValue(true);
        assertThat(actions).containsExactly("off");
    }

    @Test
    void failingAction_givesUpAfterMaxAttempts() {
        when(api.isAvailable(SWITCH)).thenReturn(true);
        RetryAttempt attempt = retryExecutor.attempt("turn off", SWITCH, () -> {
            actions.add("off");
            throw new IllegalStateException("boom");
        });

        advanceTimeAndRunDueTasks();
        advanceTimeAndRunDueTasks();
        advanceTimeAndRunDueTasks();

        assertThat(attempt.future()).isCompletedWithValue(false);
        assertThat(actions).hasSize(3);
        assertThat(scheduler.getScheduledTasks()).isEmpty();
    }

    @Test
    void becomesAvailable_runsEarly_delayedWakeUpIgnored() {
        when(api.isAvailable(SWITCH)).thenReturn(false);
        RetryAttempt attempt = retryExecutor.attempt("turn off", SWITCH, () -> actions.add("off"));

        when(api.isAvailable(SWITCH)).thenReturn(true);
        retryExecutor.onEntityAvailable(SWITCH);
        assertThat(attempt.future()).isCompletedWithValue(true);

        advanceTimeAndRunDueTasks();

        assertThat(actions).containsExactly("off");
    }

    @Test
    void availabilityOfOtherEntity_doesNotWakeUp() {
        when(api.isAvailable(SWITCH)).thenReturn(false);
        RetryAttempt attempt = retryExecutor.attempt("turn off", SWITCH, () -> actions.add("off"));

        retryExecutor.onEntityAvailable("switch.other");

        assertThat(attempt.future()).isNotDone();
    }

    @Test
    void cancelled_completesWithFalse_neverRunsAgain() {
        when(api.isAvailable(SWITCH)).thenReturn(false);
        RetryAttempt attempt = retryExecutor.attempt("turn off", SWITCH, () -> actions.add("off"));

        attempt.cancel();
        when(api.isAvailable(SWITCH)).thenReturn(true);
        retryExecutor.onEntityAvailable(SWITCH);
        advanceTimeAndRunDueTasks();

        assertThat(attempt.future()).isCompletedWithValue(false);
        assertThat(actions).isEmpty();
    }

    @Test
    void invalidPolicy_throws() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofSeconds(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
