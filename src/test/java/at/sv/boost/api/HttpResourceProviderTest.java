package at.sv.boost.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URL;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Slf4j
class HttpResourceProviderTest {

    private HttpResourceProviderImpl provider;
    private MockWebServer server;
    private URL url;

    @BeforeEach
    void setUp() throws IOException {
        provider = new HttpResourceProviderImpl(new OkHttpClient());
        server = new MockWebServer();
        server.start();
        url = server.url("/api/states").url();
    }

    @AfterEach
    void tearDown() {
        try {
            server.shutdown();
        } catch (IOException e) {
            log.error("Failed to shut down mock server (ignored): {}", e.getMessage());
        }
    }

    private void respondWith(int code, String body) {
        server.enqueue(new MockResponse().setResponseCode(code).setBody(body));
    }

    @Test
    void get_returnsBody() {
        respondWith(200, "[]");

        assertThat(provider.getResource(url)).isEqualTo("[]");
    }

    @Test
    void post_sendsJsonBody() throws InterruptedException {
        respondWith(200, "[]");

        provider.postResource(url, "{\"entity_id\":\"switch.a\"}");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"entity_id\":\"switch.a\"}");
    }

    @Test
    void unauthorized_authenticationFailure() {
        respondWith(401, "401: Unauthorized");
        respondWith(403, "403: Forbidden");

        assertThatThrownBy(() -> provider.getResource(url)).isInstanceOf(HassAuthenticationFailure.class);
        assertThatThrownBy(() -> provider.getResource(url)).isInstanceOf(HassAuthenticationFailure.class);
    }

    @Test
    void notFound_resourceNotFound() {
        respondWith(404, "{\"message\": \"Entity not found.\"}");

        assertThatThrownBy(() -> provider.getResource(url)).isInstanceOf(ResourceNotFoundException.class)
                                                           .hasMessageContaining("Entity not found.");
    }

    @Test
    void otherErrors_apiFailure() {
        respondWith(429, "");
        respondWith(500, "Internal Server Error");
        respondWith(400, "{\"message\": \"Invalid JSON specified.\"}");

        assertThatThrownBy(() -> provider.getResource(url)).isInstanceOf(ApiFailure.class)
                                                           .hasMessage("Rate limit exceeded");
        assertThatThrownBy(() -> provider.postResource(url, "{}")).isInstanceOf(ApiFailure.class)
                                                                   .hasMessageContaining("Server error");
        assertThatThrownBy(() -> provider.postResource(url, "{}")).isInstanceOf(ApiFailure.class)
                                                                   .hasMessageContaining("400");
    }

    @Test
    void unreachable_connectionFailure() throws IOException {
        server.shutdown();

        assertThatThrownBy(() -> provider.getResource(url)).isInstanceOf(HassConnectionFailure.class);
    }
}
