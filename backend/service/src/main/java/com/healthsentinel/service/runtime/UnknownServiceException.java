package com.healthsentinel.service.runtime;

public class UnknownServiceException extends RuntimeException {
    public UnknownServiceException(String serviceName) {
        super("Service not scheduled: " + serviceName);
    }
}
