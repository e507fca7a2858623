package com.ipcsentinel.core.mediator;

/**
 * Host-supplied check for channels registered with {@code requireAuth}.
 */
@FunctionalInterface
public interface Authenticator {

    boolean isAuthenticated(CallerContext context);
}
