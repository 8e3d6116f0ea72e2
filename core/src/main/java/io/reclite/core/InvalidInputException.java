package io.reclite.core;

public final class InvalidInputException extends StoreException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(ErrorKind.INVALID_INPUT, message, cause);
    }
}
