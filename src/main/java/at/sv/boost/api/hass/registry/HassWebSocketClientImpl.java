package at.sv.boost.api.hass.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Request/response client for the Home Assistant WebSocket API. The connection is opened lazily on the first
 * command and re-opened on the next command after it was lost.
 */
@Slf4j
public class HassWebSocketClientImpl implements HassWebSocketClient {

    private final String url;
    private final String accessToken;
    private final OkHttpClient client;
    private final int requestTimeoutSeconds;
    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicInteger messageIdCounter = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<String>> pendingRequests = new ConcurrentHashMap<>();

    private Connection connection;

    public HassWebSocketClientImpl(String origin, String accessToken, OkHttpClient client, int requestTimeoutSeconds) {
        this.url = origin + "/api/websocket";
        this.accessToken = accessToken;
        this.client = client;
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    @Override
    public String sendCommand(String commandType) {
        int id = messageIdCounter.getAndIncrement();
        CompletableFuture<String> response = new CompletableFuture<>();
        pendingRequests.put(id, response);
        try {
            WebSocket webSocket = getAuthenticatedConnection().webSocket;
            String message = createCommand(id, commandType);
            log.trace("Send: {}", message);
            if (!webSocket.send(message)) {
                throw new HassWebSocketException("Failed to send '" + commandType + "' over WebSocket.");
            }
            return await(response, "Timeout or error waiting for response to '" + commandType + "'.");
        } finally {
            pendingRequests.remove(id);
        }
    }

    private String createCommand(int id, String commandType) {
        ObjectNode command = mapper.createObjectNode();
        command.put("id", id);
        command.put("type", commandType);
        try {
            return mapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new HassWebSocketException("Failed to serialize command", e);
        }
    }

    private Connection getAuthenticatedConnection() {
        Connection current;
        synchronized (this) {
            if (connection == null) {
                log.trace("Connecting to HA WebSocket...");
                connection = new Connection();
                connection.webSocket = client.newWebSocket(new Request.Builder().url(url).build(),
                        new Listener(connection));
            }
            current = connection;
        }
        try {
            await(current.authenticated, "Authentication timed out or failed.");
        } catch (HassWebSocketException e) {
            drop(current, e);
            throw e;
        }
        return current;
    }

    private <T> T await(CompletableFuture<T> future, String errorMessage) {
        try {
            return future.get(requestTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HassWebSocketException(errorMessage, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new HassWebSocketException(errorMessage, e);
        }
    }

    private void drop(Connection lost, Throwable cause) {
        synchronized (this) {
            if (connection != lost) {
                return;
            }
            connection = null;
        }
        lost.authenticated.completeExceptionally(cause);
        pendingRequests.values().forEach(future -> future.completeExceptionally(cause));
    }

    private void onMessage(Connection source, WebSocket webSocket, String text) throws JsonProcessingException {
        JsonNode node = mapper.readTree(text);
        String type = node.path("type").asText();
        if ("auth_required".equals(type)) {
            webSocket.send(String.format("{\"type\": \"auth\", \"access_token\": \"%s\"}", accessToken));
        } else if ("auth_ok".equals(type)) {
            source.authenticated.complete(null);
        } else if ("auth_invalid".equals(type)) {
            log.error("WebSocket authentication failed: '{}'", text);
            drop(source, new HassWebSocketException("Authentication failed: '" + text + "'"));
        } else if (node.has("id")) {
            CompletableFuture<String> future = pendingRequests.get(node.get("id").asInt());
            if (future != null) {
                future.complete(text);
            }
        }
    }

    private static final class Connection {
        private volatile WebSocket webSocket;
        private final CompletableFuture<Void> authenticated = new CompletableFuture<>();
    }

    private final class Listener extends WebSocketListener {
        private final Connection owner;

        private Listener(Connection owner) {
            this.owner = owner;
        }

        @Override
        public void onOpen(@NotNull WebSocket webSocket, @NotNull Response response) {
            log.debug("HA WebSocket connected.");
            owner.webSocket = webSocket;
        }

        @Override
        public void onMessage(@NotNull WebSocket webSocket, @NotNull String text) {
            try {
                HassWebSocketClientImpl.this.onMessage(owner, webSocket, text);
            } catch (Exception e) {
                log.error("Failed to handle WebSocket message: '{}'", text, e);
            }
        }

        @Override
        public void onClosing(@NotNull WebSocket webSocket, int code, @NotNull String reason) {
            log.trace("WebSocket is closing: [{}] {}", code, reason);
            webSocket.close(code, reason);
            drop(owner, new HassWebSocketException("WebSocket closing: " + reason));
        }

        @Override
        public void onFailure(@NotNull WebSocket webSocket, @NotNull Throwable t, @Nullable Response response) {
            log.warn("WebSocket failure: '{}'", t.getMessage());
            drop(owner, t);
        }
    }
}
