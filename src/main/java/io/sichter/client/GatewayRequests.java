package io.sichter.client;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;

final class GatewayRequests {
    private GatewayRequests() {
    }

    static HttpRequest.Builder get(URI baseUri, String pathAndQuery, String apiKey, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(resolve(baseUri, pathAndQuery)).GET();
        if (timeout != null) {
            builder.timeout(timeout);
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("X-API-Key", apiKey);
        }
        return builder;
    }

    static URI resolve(URI baseUri, String pathAndQuery) {
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + pathAndQuery);
    }
}
