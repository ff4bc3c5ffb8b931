package com.onboarding.core.protocol;

import com.onboarding.core.CollaboratorUnreachableException;

/**
 * The protocol store could not be read or written.
 */
public class ProtocolStoreUnavailableException extends CollaboratorUnreachableException {

    public ProtocolStoreUnavailableException(String message, String traceId, Throwable cause) {
        super(message, traceId, cause);
    }
}
