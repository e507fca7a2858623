package com.ipcsentinel.core.mediator;

import java.util.List;

/**
 * Business logic behind a channel.
 *
 * <p>
 * Receives the arguments after validation and sanitization. May return a
 * {@link java.util.concurrent.CompletionStage}; the mediator waits for it and
 * treats a failed stage like a thrown exception.
 * </p>
 */
@FunctionalInterface
public interface IpcHandler {

    Object handle(CallerContext context, List<Object> args) throws Exception;
}
