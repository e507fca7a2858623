/**
 * The IPC mediator: channel registration, the per-call security pipeline and
 * input sanitizers.
 *
 * <p>
 * Entry point is {@link com.ipcsentinel.core.mediator.IpcMediator}. Policies
 * are described by {@link com.ipcsentinel.core.mediator.HandlerOptions}.
 * </p>
 *
 * @since 1.0.0
 */
package com.ipcsentinel.core.mediator;
