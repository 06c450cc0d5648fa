package com.healthsentinel.service.runtime;

public class DuplicateServiceException extends RuntimeException {
    public DuplicateServiceException(String serviceName) {
        super("Service already scheduled: " + serviceName);
    }
}
