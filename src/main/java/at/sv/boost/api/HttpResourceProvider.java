package at.sv.boost.api;

import java.net.URL;

/**
 * Plain HTTP transport for the Home Assistant REST API. Non-2xx responses are mapped to the unchecked failures of
 * this package, so callers only deal with response bodies.
 */
public interface HttpResourceProvider {

    /**
     * @return the response body, never null
     * @throws HassAuthenticationFailure on 401 or 403
     * @throws ResourceNotFoundException on 404
     * @throws ApiFailure                on any other unsuccessful status
     * @throws HassConnectionFailure     when the request could not be sent or the response not read
     */
    String getResource(URL url);

    /**
     * Sends {@code body} as JSON. Failures are mapped like {@link #getResource(URL)}.
     *
     * @return the response body, never null
     */
    String postResource(URL url, String body);
}
