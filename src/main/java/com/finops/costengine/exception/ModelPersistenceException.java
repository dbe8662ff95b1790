package com.finops.costengine.exception;

public class ModelPersistenceException extends RuntimeException {

    public ModelPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
