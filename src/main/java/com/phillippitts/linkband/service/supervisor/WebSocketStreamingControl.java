package com.phillippitts.linkband.service.supervisor;

import com.phillippitts.linkband.protocol.BridgeCommand;
import com.phillippitts.linkband.service.transport.ConnectionTransport;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Sends {@code start_streaming} / {@code stop_streaming} over the bridge WebSocket.
 */
@Component
public class WebSocketStreamingControl implements StreamingControl {

    @Override
    public CompletableFuture<Void> requestStreaming(boolean streaming, ConnectionTransport transport) {
        BridgeCommand command = streaming ? BridgeCommand.START_STREAMING : BridgeCommand.STOP_STREAMING;
        return transport.send(command.encode());
    }
}
