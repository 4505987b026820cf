package com.phillippitts.linkband.service.api;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * {@link ApiHealthCheck} issuing {@code GET} on the bridge's health route.
 */
public class HttpApiHealthCheck implements ApiHealthCheck {

    private static final Logger LOG = LogManager.getLogger(HttpApiHealthCheck.class);

    private final HttpClient httpClient;
    private final URI healthUri;
    private final Duration timeout;
    private volatile boolean lastReachable = true;

    public HttpApiHealthCheck(HttpClient httpClient, URI healthUri, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.healthUri = Objects.requireNonNull(healthUri, "healthUri");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public CompletionStage<Boolean> check() {
        HttpRequest request = HttpRequest.newBuilder(healthUri)
                .timeout(timeout)
                .GET()
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean ok = response.statusCode() / 100 == 2;
                    if (!ok) {
                        logTransition(false, "HTTP " + response.statusCode());
                    } else {
                        logTransition(true, null);
                    }
                    return ok;
                })
                .exceptionally(e -> {
                    logTransition(false, e.getMessage());
                    return false;
                });
    }

    // Logs only on reachability changes.
    private void logTransition(boolean reachable, String detail) {
        if (reachable != lastReachable) {
            lastReachable = reachable;
            if (reachable) {
                LOG.info("Bridge API reachable again at {}", healthUri);
            } else {
                LOG.warn("Bridge API unreachable at {}: {}", healthUri, detail);
            }
        }
    }
}
