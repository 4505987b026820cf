package com.phillippitts.linkband.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsAreUncheckedLinkBandExceptions() {
        assertThat(new TransportException("x")).isInstanceOf(LinkBandException.class)
                .isInstanceOf(RuntimeException.class);
        assertThat(new ProtocolException("x")).isInstanceOf(LinkBandException.class);
        assertThat(new SupervisorConfigurationException("p", "m")).isInstanceOf(LinkBandException.class);
    }

    @Test
    void healthTimeoutIsHandledAsTransportFailure() {
        HealthTimeoutException e = new HealthTimeoutException(2, 2000);

        assertThat(e).isInstanceOf(TransportException.class);
        assertThat(e.getMissedAcknowledgements()).isEqualTo(2);
        assertThat(e.getMessage()).contains("2 consecutive").contains("2000ms");
        assertThat(e.getEndpoint()).isEqualTo("unknown");
    }

    @Test
    void transportExceptionCarriesEndpointAndCause() {
        IOException cause = new IOException("reset");
        TransportException e = new TransportException("Link failed", "ws://localhost:18765", cause);

        assertThat(e.getEndpoint()).isEqualTo("ws://localhost:18765");
        assertThat(e.getMessage()).contains("ws://localhost:18765");
        assertThat(e.getCause()).isSameAs(cause);
    }

    @Test
    void protocolExceptionKeepsReason() {
        ProtocolException e = new ProtocolException("missing type");

        assertThat(e.getReason()).isEqualTo("missing type");
        assertThat(e.getMessage()).isEqualTo("Malformed bridge frame: missing type");
    }

    @Test
    void configurationExceptionNamesProperty() {
        SupervisorConfigurationException e =
                new SupervisorConfigurationException("linkband.supervisor.health.timeout-ms", "too small");

        assertThat(e.getProperty()).isEqualTo("linkband.supervisor.health.timeout-ms");
        assertThat(e.getMessage()).isEqualTo("Invalid linkband.supervisor.health.timeout-ms: too small");
    }
}
