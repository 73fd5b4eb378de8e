package com.hhplus.ordering.domain.exception;

public class InvalidQuantityException extends IllegalArgumentException {

    public InvalidQuantityException(String message) {
        super(message);
    }
}
