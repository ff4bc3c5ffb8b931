package com.onboarding.core.assignment;

import com.onboarding.core.CollaboratorUnreachableException;

public class AssignmentUnreachableException extends CollaboratorUnreachableException {

    public AssignmentUnreachableException(String message, String traceId) {
        super(message, traceId);
    }

    public AssignmentUnreachableException(String message, String traceId, Throwable cause) {
        super(message, traceId, cause);
    }
}
