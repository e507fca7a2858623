/**
 * Caller frame and origin checks.
 */
package com.ipcsentinel.core.sender;
