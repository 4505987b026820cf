package com.phillippitts.linkband.protocol;

/**
 * Well-formed frame of a type the supervisor does not consume (for example {@code pong} or
 * {@code status}). Ignored by the dispatch loop.
 */
public record UnhandledMessage(String type) implements BridgeMessage {
}
