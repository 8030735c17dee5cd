package com.smerag.runtime;

public class TransientServiceException extends RuntimeException {
    private final String service;

    public TransientServiceException(String service, String message) {
        super(service + ": " + message);
        this.service = service;
    }

    public TransientServiceException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }

    public String service() {
        return service;
    }
}
