/**
 * Exception taxonomy of the mediator. All types are unchecked and extend
 * {@link com.ipcsentinel.core.exception.IpcSecurityException}.
 */
package com.ipcsentinel.core.exception;
