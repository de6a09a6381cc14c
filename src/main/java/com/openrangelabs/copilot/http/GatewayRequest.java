package com.openrangelabs.copilot.http;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * Transport-neutral description of one outgoing request.
 *
 * <p>Query parameters and headers keep insertion order. {@code body}, when set,
 * is serialized as JSON.
 */
@Value
@Builder
public class GatewayRequest {

    HttpMethod method;

    String url;

    @Singular
    Map<String, String> queryParams;

    @Singular
    Map<String, String> headers;

    Object body;

    public boolean hasBody() {
        return body != null;
    }
}
