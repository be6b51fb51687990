package com.zerarate.rate.source.validator;

/**
 * Thrown when a validator call fails (HTTP status or transport error).
 */
public class ValidatorClientException extends RuntimeException {

    public ValidatorClientException(String message) {
        super(message);
    }

    public ValidatorClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
