package at.sv.boost.api.hass;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps a subscription to the Home Assistant event bus open and forwards every message to the
 * {@link HassEventHandler}. Subscriptions are sent once the connection is authenticated. A failed or closed stream
 * is re-opened after {@value #RECONNECT_DELAY_SECONDS} seconds.
 */
@Slf4j
public final class HassEventStreamReader {

    private static final int RECONNECT_DELAY_SECONDS = 3;
    private static final List<String> SUBSCRIBED_EVENTS = List.of(
            "state_changed",
            "homeassistant_started",
            HassEventHandler.BOOST_START_EVENT,
            HassEventHandler.BOOST_FINISH_EVENT,
            HassEventHandler.BOOST_SET_EVENT);

    private final Request request;
    private final String accessToken;
    private final OkHttpClient client;
    private final HassEventHandler eventHandler;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ScheduledExecutorService reconnectScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "hass-event-stream");
        thread.setDaemon(true);
        return thread;
    });

    public HassEventStreamReader(String websocketOrigin, String accessToken, OkHttpClient client,
                                 HassEventHandler eventHandler) {
        this.request = new Request.Builder().url(websocketOrigin + "/api/websocket").build();
        this.accessToken = accessToken;
        this.client = client.newBuilder()
                            .retryOnConnectionFailure(true)
                            .pingInterval(30, TimeUnit.SECONDS)
                            .build();
        this.eventHandler = eventHandler;
    }

    public void start() {
        inEventContext(() -> {
            log.trace("Connecting to HA event stream...");
            client.newWebSocket(request, new StreamListener());
        });
    }

    private void reconnectLater() {
        reconnectScheduler.schedule(this::start, RECONNECT_DELAY_SECONDS, TimeUnit.SECONDS);
    }

    private static void inEventContext(Runnable runnable) {
        MDC.put("context", "events");
        try {
            runnable.run();
        } finally {
            MDC.remove("context");
        }
    }

    /**
     * One listener per connection, since message ids have to increase within a single connection only.
     */
    private final class StreamListener extends WebSocketListener {
        private int nextMessageId = 1;

        @Override
        public void onOpen(@NotNull WebSocket webSocket, @NotNull Response response) {
            inEventContext(() -> log.debug("HA event stream opened."));
        }

        @Override
        public void onMessage(@NotNull WebSocket webSocket, @NotNull String text) {
            inEventContext(() -> {
                try {
                    handleHandshake(webSocket, text);
                    eventHandler.onMessage(text);
                } catch (Exception e) {
                    log.error("Failed to handle event stream message '{}': {}", text, e.getLocalizedMessage(), e);
                }
            });
        }

        private void handleHandshake(WebSocket webSocket, String text) throws JsonProcessingException {
            switch (mapper.readTree(text).path("type").asText()) {
                case "auth_required" -> webSocket.send(
                        String.format("{\"type\": \"auth\", \"access_token\": \"%s\"}", accessToken));
                case "auth_ok" -> {
                    log.info("HA event stream connected.");
                    SUBSCRIBED_EVENTS.forEach(eventType -> webSocket.send(String.format(
                            "{\"id\": %d, \"type\": \"subscribe_events\", \"event_type\": \"%s\"}",
                            nextMessageId++, eventType)));
                }
                default -> {
                }
            }
        }

        @Override
        public void onClosing(@NotNull WebSocket webSocket, int code, @NotNull String reason) {
            inEventContext(() -> log.warn("HA event stream closing: [{}] {}. Reconnecting in {}s.", code, reason,
                    RECONNECT_DELAY_SECONDS));
            webSocket.close(code, reason);
            reconnectLater();
        }

        @Override
        public void onFailure(@NotNull WebSocket webSocket, @NotNull Throwable t, @Nullable Response response) {
            inEventContext(() -> log.warn("HA event stream failure: '{}'. Reconnecting in {}s.", t.getMessage(),
                    RECONNECT_DELAY_SECONDS));
            webSocket.cancel();
            reconnectLater();
        }
    }
}
