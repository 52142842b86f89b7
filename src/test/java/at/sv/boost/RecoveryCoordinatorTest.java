package at.sv.boost;

import at.sv.boost.api.EntityState;
import at.sv.boost.api.HomeAssistantApi;
import at.sv.boost.retry.RetryExecutor;
import at.sv.boost.retry.RetryPolicy;
import at.sv.boost.store.JsonFileSettingsStore;
import at.sv.boost.store.JsonFileStorage;
import at.sv.boost.store.JsonFileTimerStore;
import at.sv.boost.store.PersistedBoostRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecoveryCoordinatorTest {

    private static final String DEVICE = "climate.living_room";

    @TempDir
    Path tempDir;

    private Instant now;
    private HomeAssistantApi api;
    private TestTaskScheduler scheduler;
    private JsonFileStorage storage;
    private JsonFileTimerStore timerStore;
    private BoostManager manager;
    private RecoveryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        now = Instant.parse("2024-01-10T10:00:00Z");
        api = mock(HomeAssistantApi.class);
        scheduler = new TestTaskScheduler(() -> now);
        storage = new JsonFileStorage(tempDir.resolve("storage.json"));
        timerStore = new JsonFileTimerStore(storage);
        when(api.getTemperatureUnit()).thenReturn(TemperatureUnit.METRIC);
        when(api.isAvailable(anyString())).thenReturn(true);
        when(api.getState(DEVICE)).thenReturn(EntityState.builder().entityId(DEVICE).state("heat").temperature(23.0)
                                                         .minTemp(7).maxTemp(30).build());
        when(api.getState("switch.schedule_a")).thenReturn(EntityState.builder().entityId("switch.schedule_a")
                                                                      .state("off").build());
    }

    private void startUp() {
        RetryExecutor retryExecutor = new RetryExecutor(api, scheduler, Runnable::run,
                new RetryPolicy(3, Duration.ofSeconds(10)));
        manager = new BoostManager(List.of(new ThermostatDevice(DEVICE, null, false)), api, timerStore,
                new JsonFileSettingsStore(storage), retryExecutor, new DeviceTaskQueue(Runnable::run), scheduler,
                mock(BoostStateListener.class), () -> now, Duration.ofHours(24));
        manager.initialize().join();
        coordinator = new RecoveryCoordinator(timerStore, manager, () -> now);
        coordinator.startup().join();
        manager.acceptCommands();
    }

    private void persist(String deviceId, Instant end, List<ScheduleSwitchState> snapshot) {
        timerStore.save(deviceId, new PersistedBoostRecord(end.toEpochMilli(), 19.0, snapshot, false));
    }

    @Test
    void expiredWhileOffline_finishedExactlyOnce() {
        persist(DEVICE, now.minus(Duration.ofMinutes(5)), List.of(new ScheduleSwitchState("switch.schedule_a", true)));

        startUp();
        coordinator.startup().join();

        verify(api, times(1)).setTargetTemperature(DEVICE, 19.0);
        verify(api, times(1)).turnOn("switch.schedule_a");
        verify(api, times(1)).runScheduleAction("switch.schedule_a");
        assertThat(manager.getState(DEVICE).isActive()).isFalse();
        assertThat(timerStore.getAll()).isEmpty();
        assertThat(scheduler.getScheduledTasks()).isEmpty();
    }

    @Test
    void expiredWhileOffline_entitiesUnavailable_restoredOnceTheyReportAvailable() {
        persist(DEVICE, now.minus(Duration.ofMinutes(5)), List.of(new ScheduleSwitchState("switch.schedule_a", true)));
        when(api.isAvailable(DEVICE)).thenReturn(false);
        when(api.isAvailable("switch.schedule_a")).thenReturn(false);

        startUp();

        verify(api, never()).setTargetTemperature(anyString(), anyDouble());
        verify(api, never()).turnOn(anyString());
        assertThat(manager.getState(DEVICE).isActive()).isFalse();
        assertThat(timerStore.getAll()).isEmpty();

        when(api.isAvailable(DEVICE)).thenReturn(true);
        manager.onStateChanged(DEVICE, unavailable(DEVICE), api.getState(DEVICE));

        verify(api).setTargetTemperature(DEVICE, 19.0);
        verify(api, never()).turnOn("switch.schedule_a");

        when(api.isAvailable("switch.schedule_a")).thenReturn(true);
        manager.onStateChanged("switch.schedule_a", unavailable("switch.schedule_a"), api.getState("switch.schedule_a"));

        verify(api).turnOn("switch.schedule_a");
        verify(api).runScheduleAction("switch.schedule_a");

        now = now.plus(Duration.ofMinutes(1));
        scheduler.runDueTasks();
        coordinator.startup().join();

        verify(api, times(1)).setTargetTemperature(DEVICE, 19.0);
        verify(api, times(1)).turnOn("switch.schedule_a");
        verify(api, times(1)).runScheduleAction("switch.schedule_a");
    }

    private static EntityState unavailable(String entityId) {
        return EntityState.builder().entityId(entityId).state("unavailable").build();
    }

    @Test
    void endingExactlyNow_isTreatedAsExpired() {
        persist(DEVICE, now, null);

        startUp();

        verify(api).setTargetTemperature(DEVICE, 19.0);
        assertThat(timerStore.get(DEVICE)).isNull();
    }

    @Test
    void expiredWhileOffline_missingSwitchIsSkipped() {
        persist(DEVICE, now.minusSeconds(1), List.of(new ScheduleSwitchState("switch.schedule_a", true),
                new ScheduleSwitchState("switch.schedule_removed", true)));

        startUp();

        verify(api).turnOn("switch.schedule_a");
        verify(api, never()).turnOn("switch.schedule_removed");
    }

    @Test
    void stillRunning_resumedWithRemainingTime() {
        Instant end = now.plus(Duration.ofMinutes(45));
        persist(DEVICE, end, List.of(new ScheduleSwitchState("switch.schedule_a", true)));

        startUp();

        DeviceBoostState state = manager.getState(DEVICE);
        assertThat(state.isActive()).isTrue();
        assertThat(state.endTimestamp()).isEqualTo(end);
        assertThat(scheduler.getScheduledTasks()).extracting(TestTaskScheduler.ScheduledTask::due)
                                                 .containsExactly(end);
        verify(api).turnOff("switch.schedule_a");
        verify(api, never()).setTargetTemperature(anyString(), anyDouble());
    }

    @Test
    void resumed_finishesWithPersistedSnapshot() {
        Instant end = now.plus(Duration.ofMinutes(45));
        persist(DEVICE, end, List.of(new ScheduleSwitchState("switch.schedule_a", false)));
        startUp();

        now = end;
        scheduler.runDueTasks();

        verify(api).setTargetTemperature(DEVICE, 19.0);
        verify(api, times(2)).turnOff("switch.schedule_a");
        verify(api, never()).turnOn("switch.schedule_a");
        assertThat(timerStore.getAll()).isEmpty();
    }

    @Test
    void unknownDevice_recordDiscarded() {
        persist("climate.removed", now.plus(Duration.ofHours(1)), null);

        startUp();

        assertThat(timerStore.getAll()).isEmpty();
        verify(api, never()).setTargetTemperature(anyString(), anyDouble());
    }
}
