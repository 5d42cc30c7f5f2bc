package com.example.taskreminder.exception;

import lombok.Getter;

/**
 * Exception for messaging transport failures
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String serviceName;

    public ExternalServiceException(String serviceName, String message) {
        super(String.format("[%s] %s", serviceName, message));
        this.serviceName = serviceName;
    }

    public ExternalServiceException(String serviceName, Exception cause) {
        super(String.format("[%s] %s", serviceName, cause.getMessage()), cause);
        this.serviceName = serviceName;
    }
}
