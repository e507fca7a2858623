package com.ipcsentinel.core.ratelimit;

/**
 * Derives the request-log key for a call.
 *
 * <p>
 * The default generator partitions by channel and sender; custom generators
 * can share one budget across senders or across channels.
 * </p>
 */
@FunctionalInterface
public interface KeyGenerator {

    /** Keys of the form {@code channel:senderId}. */
    KeyGenerator PER_CHANNEL_AND_SENDER = (channel, senderId) -> channel + ":" + senderId;

    String generate(String channel, String senderId);
}
