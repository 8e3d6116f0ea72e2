package io.reclite.core;

public final class KeyExtractionException extends StoreException {

    public KeyExtractionException(String message) {
        super(ErrorKind.KEY_EXTRACTION_FAILED, message);
    }
}
