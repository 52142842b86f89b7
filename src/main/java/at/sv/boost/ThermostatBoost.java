package at.sv.boost;

import at.sv.boost.api.HassAuthenticationFailure;
import at.sv.boost.api.HassConnectionFailure;
import at.sv.boost.api.HomeAssistantApi;
import at.sv.boost.api.HttpResourceProviderImpl;
import at.sv.boost.api.hass.HassApiImpl;
import at.sv.boost.api.hass.HassApiUtils;
import at.sv.boost.api.hass.HassAvailabilityListener;
import at.sv.boost.api.hass.HassEventHandler;
import at.sv.boost.api.hass.HassEventStreamReader;
import at.sv.boost.api.hass.registry.HassEntityRegistryImpl;
import at.sv.boost.api.hass.registry.HassWebSocketClientImpl;
import at.sv.boost.retry.RetryExecutor;
import at.sv.boost.retry.RetryPolicy;
import at.sv.boost.store.JsonFileSettingsStore;
import at.sv.boost.store.JsonFileStorage;
import at.sv.boost.store.JsonFileTimerStore;
import com.github.benmanes.caffeine.cache.Ticker;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Command(name = "ThermostatBoost", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class ThermostatBoost implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ThermostatBoost.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            index = "0",
            defaultValue = "${env:API_HOST}",
            description = "The origin (i.e. scheme, host, port) of your Home Assistant instance. " +
                          "Examples: http://localhost:8123, or https://UNIQUE_ID.ui.nabu.casa")
    String apiHost;
    @Parameters(
            index = "1",
            defaultValue = "${env:ACCESS_TOKEN}",
            description = "The long-lived Home Assistant access token used for authentication.")
    String accessToken;
    @Parameters(
            index = "2",
            paramLabel = "CONFIG_FILE",
            defaultValue = "${env:CONFIG_FILE}",
            description = "The configuration file listing the thermostats to manage.")
    Path configFile;
    @Option(names = "--storage-file", paramLabel = "<file>",
            defaultValue = "${env:STORAGE_FILE:-thermostat_boost.json}",
            description = "The file active boosts and settings are persisted to. Default: ${DEFAULT-VALUE}")
    Path storageFile;
    @Option(names = "--max-boost-duration", paramLabel = "<hours>",
            defaultValue = "${env:MAX_BOOST_DURATION:-24}",
            description = "The maximum duration of a boost in hours. Longer requests are shortened. " +
                          "Default: ${DEFAULT-VALUE} hours.")
    double maxBoostDurationInHours;
    @Option(names = "--retry-attempts", paramLabel = "<attempts>",
            defaultValue = "${env:RETRY_ATTEMPTS:-5}",
            description = "How often to try restoring a temperature or schedule switch before giving up. " +
                          "Default: ${DEFAULT-VALUE}")
    int retryAttempts;
    @Option(names = "--retry-delay", paramLabel = "<delay>",
            defaultValue = "${env:RETRY_DELAY:-10}",
            description = "The delay in seconds between two restore attempts. An attempt waiting for an unavailable " +
                          "entity is run earlier if the entity becomes available. Default: ${DEFAULT-VALUE} seconds.")
    int retryDelayInSeconds;
    @Option(names = "--connection-retry-delay", paramLabel = "<delay>",
            defaultValue = "${env:CONNECTION_RETRY_DELAY:-5}",
            description = "The delay in seconds for retrying the initial connection, if Home Assistant is not " +
                          "reachable or not fully started yet. Default: ${DEFAULT-VALUE} seconds.")
    int connectionRetryDelayInSeconds;
    @Option(names = "--websocket-timeout", paramLabel = "<timeout>",
            defaultValue = "${env:WEBSOCKET_TIMEOUT:-5}",
            description = "The timeout in seconds for requests over the Home Assistant WebSocket API. " +
                          "Default: ${DEFAULT-VALUE} seconds.")
    int websocketTimeoutInSeconds;

    private HomeAssistantApi api;
    private BoostManager boostManager;
    private TaskScheduler taskScheduler;
    private JsonFileStorage storage;
    private JsonFileTimerStore timerStore;
    private List<ThermostatDevice> devices;

    public static void main(String[] args) {
        int execute = new CommandLine(new ThermostatBoost()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        assertInputIsReadable();
        devices = parseInput();
        ExecutorService executor = Executors.newCachedThreadPool();
        taskScheduler = new TaskSchedulerImpl(Executors.newSingleThreadScheduledExecutor(), executor);
        storage = new JsonFileStorage(storageFile);
        setupHassApi(executor);
        assertConnectionAndStart();
    }

    private void setupHassApi(ExecutorService executor) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    Request request = chain.request().newBuilder()
                                           .header("Authorization", "Bearer " + accessToken)
                                           .build();
                    return chain.proceed(request);
                })
                .build();
        String websocketOrigin = HassApiUtils.getHassWebsocketOrigin(apiHost);
        HassEntityRegistryImpl entityRegistry = new HassEntityRegistryImpl(
                new HassWebSocketClientImpl(websocketOrigin, accessToken, httpClient, websocketTimeoutInSeconds),
                Ticker.systemTicker(), Duration.ofMinutes(5));
        HassAvailabilityListener availabilityListener = new HassAvailabilityListener(this::onHassRestarted);
        api = new HassApiImpl(apiHost, new HttpResourceProviderImpl(httpClient), entityRegistry, availabilityListener);
        RetryExecutor retryExecutor = new RetryExecutor(api, taskScheduler, executor,
                new RetryPolicy(retryAttempts, Duration.ofSeconds(retryDelayInSeconds)));
        timerStore = new JsonFileTimerStore(storage);
        boostManager = new BoostManager(devices, api, timerStore, new JsonFileSettingsStore(storage), retryExecutor,
                new DeviceTaskQueue(executor), taskScheduler, new HassStatePublisher(api, ZoneId.systemDefault()),
                Instant::now, DurationParser.ofHours(maxBoostDurationInHours));
        new HassEventStreamReader(websocketOrigin, accessToken, httpClient,
                new HassEventHandler(boostManager, availabilityListener)).start();
    }

    private void onHassRestarted() {
        api.clearCaches();
        if (boostManager != null) {
            boostManager.republishAll();
        }
    }

    private void assertConfigurationParameters() {
        if (maxBoostDurationInHours <= 0) {
            fail("--max-boost-duration must be > 0");
        }
        if (retryAttempts < 1) {
            fail("--retry-attempts must be >= 1");
        }
        if (retryDelayInSeconds < 0) {
            fail("--retry-delay must be >= 0");
        }
        if (connectionRetryDelayInSeconds <= 0) {
            fail("--connection-retry-delay must be > 0");
        }
        if (websocketTimeoutInSeconds <= 0) {
            fail("--websocket-timeout must be > 0");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private void assertInputIsReadable() {
        if (configFile == null || !Files.isReadable(configFile)) {
            System.err.println("Given config file '" + (configFile != null ? configFile.toAbsolutePath() : null) +
                               "' does not exist or is not readable!");
            System.exit(1);
        }
    }

    private List<ThermostatDevice> parseInput() {
        try {
            return new DeviceConfigurationParser().parse(Files.readAllLines(configFile));
        } catch (InvalidConfigurationLine | InvalidPropertyValue e) {
            System.err.println("Failed to parse configuration file '" + configFile + "':\n" +
                               e.getClass().getSimpleName() + ": " + e.getLocalizedMessage());
            System.exit(2);
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void assertConnectionAndStart() {
        if (!assertConnection()) {
            taskScheduler.schedule(this::assertConnectionAndStart, Duration.ofSeconds(connectionRetryDelayInSeconds));
        } else {
            start();
        }
    }

    private boolean assertConnection() {
        MDC.put("context", "init");
        try {
            api.assertConnection();
            LOG.info("Connected to {}.", apiHost);
        } catch (HassConnectionFailure e) {
            LOG.warn("Home Assistant not reachable: '{}'. Retrying in {}s.", getCauseMessage(e),
                    connectionRetryDelayInSeconds);
            return false;
        } catch (HassAuthenticationFailure e) {
            System.err.println("Home Assistant connection rejected: 'Unauthorized'. Please make sure you use a valid" +
                               " long-lived access token.");
            System.exit(3);
        }
        return true;
    }

    private static String getCauseMessage(Exception e) {
        return Objects.requireNonNullElse(e.getCause(), e).getLocalizedMessage();
    }

    private void start() {
        LOG.info("Managing {} thermostats: {}", devices.size(),
                devices.stream().map(ThermostatDevice::deviceId).toList());
        boostManager.initialize();
        new RecoveryCoordinator(timerStore, boostManager, Instant::now).startup();
        boostManager.acceptCommands();
        MDC.remove("context");
    }
}
