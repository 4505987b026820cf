package com.phillippitts.linkband.service.api;

import java.util.concurrent.CompletionStage;

/**
 * Reachability of the bridge REST API. The API is otherwise an opaque collaborator.
 */
@FunctionalInterface
public interface ApiHealthCheck {

    /**
     * Starts one check. Must not block the caller.
     *
     * @return stage completed with {@code true} when the API answered with a 2xx status;
     *         {@code false} (never exceptionally) when it did not answer or answered otherwise
     */
    CompletionStage<Boolean> check();
}
