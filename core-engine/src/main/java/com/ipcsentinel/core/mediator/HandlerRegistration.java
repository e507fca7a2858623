package com.ipcsentinel.core.mediator;

import java.util.Objects;

/**
 * A channel bound to its policy and handler.
 */
public final class HandlerRegistration {

    private final String channel;
    private final HandlerOptions options;
    private final IpcHandler handler;

    HandlerRegistration(String channel, HandlerOptions options, IpcHandler handler) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
    }

    public String getChannel() {
        return channel;
    }

    public HandlerOptions getOptions() {
        return options;
    }

    public IpcHandler getHandler() {
        return handler;
    }

    @Override
    public String toString() {
        return "HandlerRegistration{channel='" + channel + "', options=" + options + '}';
    }
}
