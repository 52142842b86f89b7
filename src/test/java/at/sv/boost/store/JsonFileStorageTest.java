package at.sv.boost.store;

import at.sv.boost.DeviceSettings;
import at.sv.boost.ScheduleSwitchState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileStorageTest {

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("boost.json");
    }

    private JsonFileTimerStore timerStore() {
        return new JsonFileTimerStore(new JsonFileStorage(file));
    }

    @Test
    void missingFile_isEmpty() {
        assertThat(timerStore().getAll()).isEmpty();
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    void timers_surviveRestart() {
        PersistedBoostRecord record = new PersistedBoostRecord(1_704_880_800_000L, 19.5,
                List.of(new ScheduleSwitchState("switch.schedule_a", true)), false);
        timerStore().save("climate.a", record);
        timerStore().save("climate.b", new PersistedBoostRecord(1_704_880_900_000L, null, null, true));

        JsonFileTimerStore reloaded = timerStore();

        assertThat(reloaded.get("climate.a")).isEqualTo(record);
        assertThat(reloaded.get("climate.b").preBoostTemperature()).isNull();
        assertThat(reloaded.get("climate.b").scheduleSnapshot()).isNull();
        assertThat(reloaded.get("climate.b").scheduleOverrideActive()).isTrue();
    }

    @Test
    void remove_deletesRecord_absentIsNoOp() {
        JsonFileTimerStore store = timerStore();
        store.save("climate.a", new PersistedBoostRecord(1L, 19.0, null, false));

        store.remove("climate.a");
        store.remove("climate.unknown");

        assertThat(timerStore().getAll()).isEmpty();
    }

    @Test
    void timersAndSettings_shareDocument() {
        JsonFileStorage storage = new JsonFileStorage(file);
        new JsonFileTimerStore(storage).save("climate.a", new PersistedBoostRecord(1L, 19.0, null, false));
        new JsonFileSettingsStore(storage).save("climate.a", new DeviceSettings(22.5, 2, true, false));

        JsonFileStorage reloaded = new JsonFileStorage(file);

        assertThat(new JsonFileTimerStore(reloaded).getAll()).containsOnlyKeys("climate.a");
        assertThat(new JsonFileSettingsStore(reloaded).getAll())
                .containsEntry("climate.a", new DeviceSettings(22.5, 2, true, false));
    }

    @Test
    void corruptFile_treatedAsEmpty() throws IOException {
        Files.writeString(file, "{ not json");

        JsonFileTimerStore store = timerStore();

        assertThat(store.getAll()).isEmpty();
        store.save("climate.a", new PersistedBoostRecord(1L, 19.0, null, false));
        assertThat(timerStore().getAll()).containsOnlyKeys("climate.a");
    }

    @Test
    void unsupportedVersion_treatedAsEmpty() throws IOException {
        Files.writeString(file, """
                {"version": 99, "timers": {"climate.a": {"endTimestamp": 1}}}
                """);

        assertThat(timerStore().getAll()).isEmpty();
    }

    @Test
    void writeFails_throws_keepsPreviousState() throws IOException {
        Path blocked = tempDir.resolve("blocked");
        Files.createDirectories(blocked.resolve("boost.json.tmp"));
        JsonFileTimerStore store = new JsonFileTimerStore(new JsonFileStorage(blocked.resolve("boost.json")));

        assertThatThrownBy(() -> store.save("climate.a", new PersistedBoostRecord(1L, 19.0, null, false)))
                .isInstanceOf(UncheckedIOException.class);
        assertThat(store.getAll()).isEmpty();
    }
}
