package at.sv.boost.api;

import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.net.URL;

/**
 * Blocking HTTP calls against the Home Assistant REST API. Error responses are mapped to {@link ApiFailure} and its
 * subtypes, transport errors to {@link HassConnectionFailure}.
 */
@Slf4j
public class HttpResourceProviderImpl implements HttpResourceProvider {

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_LOGGED_BODY_LENGTH = 150;

    private final OkHttpClient httpClient;

    public HttpResourceProviderImpl(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String getResource(URL url) {
        log.trace("GET {}", url);
        return execute(new Request.Builder().url(url).get().build());
    }

    @Override
    public String postResource(URL url, String json) {
        log.trace("POST {} {}", url, abbreviate(json));
        return execute(new Request.Builder().url(url).post(RequestBody.create(json, JSON_MEDIA_TYPE)).build());
    }

    private String execute(Request request) {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = readBody(response);
            if (!response.isSuccessful()) {
                throw toFailure(response.code(), body);
            }
            return body;
        } catch (IOException e) {
            throw new HassConnectionFailure(request.method() + " " + request.url() + " failed", e);
        }
    }

    private static RuntimeException toFailure(int code, String body) {
        return switch (code) {
            case 401, 403 -> new HassAuthenticationFailure();
            case 404 -> new ResourceNotFoundException("Resource not found: " + body);
            case 429 -> new ApiFailure("Rate limit exceeded");
            default -> code >= 500
                    ? new ApiFailure("Server error: " + body)
                    : new ApiFailure("Unexpected return code " + code + ": " + body);
        };
    }

    private static String readBody(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static String abbreviate(String json) {
        if (json.length() <= MAX_LOGGED_BODY_LENGTH) {
            return json;
        }
        return json.substring(0, MAX_LOGGED_BODY_LENGTH) + "...";
    }
}
