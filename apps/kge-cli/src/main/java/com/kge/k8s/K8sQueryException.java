package com.kge.k8s;

public class K8sQueryException extends RuntimeException {

    private final int status;

    public K8sQueryException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
