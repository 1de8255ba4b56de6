package com.kge.k8s;

public class K8sConnectionException extends RuntimeException {

    public K8sConnectionException(String message) {
        super(message);
    }

    public K8sConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
