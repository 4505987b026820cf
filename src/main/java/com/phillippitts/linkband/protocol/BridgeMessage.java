package com.phillippitts.linkband.protocol;

/**
 * Decoded server-to-client frame.
 *
 * @see BridgeMessageParser
 */
public interface BridgeMessage {
}
