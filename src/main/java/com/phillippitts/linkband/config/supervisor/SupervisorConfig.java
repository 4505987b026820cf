package com.phillippitts.linkband.config.supervisor;

import com.phillippitts.linkband.config.properties.SupervisorProperties;
import com.phillippitts.linkband.service.api.ApiHealthCheck;
import com.phillippitts.linkband.service.api.HttpApiHealthCheck;
import com.phillippitts.linkband.service.transport.BridgeConnector;
import com.phillippitts.linkband.service.transport.JdkWebSocketConnector;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Wires the network-facing collaborators of the bridge supervisor.
 */
@Configuration
public class SupervisorConfig {

    private final SupervisorProperties props;

    public SupervisorConfig(SupervisorProperties props) {
        this.props = props;
    }

    /**
     * Shared JDK client for the WebSocket link and REST reachability checks.
     */
    @Bean
    public HttpClient bridgeHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(props.getBridge().getConnectTimeoutMs()))
                .build();
    }

    @Bean
    public BridgeConnector bridgeConnector(HttpClient bridgeHttpClient) {
        return new JdkWebSocketConnector(bridgeHttpClient,
                Duration.ofMillis(props.getBridge().getConnectTimeoutMs()),
                Duration.ofMillis(props.getBridge().getCloseTimeoutMs()));
    }

    /**
     * REST check; a request slower than the health timeout counts as unreachable.
     */
    @Bean
    public ApiHealthCheck apiHealthCheck(HttpClient bridgeHttpClient) {
        return new HttpApiHealthCheck(bridgeHttpClient,
                URI.create(props.getBridge().getApiHealthUrl()),
                Duration.ofMillis(props.getHealth().getTimeoutMs()));
    }
}
