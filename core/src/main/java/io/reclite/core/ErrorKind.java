package io.reclite.core;

/**
 * Failure categories reported by the record store.
 * Every {@link StoreException} carries exactly one of these.
 */
public enum ErrorKind {
    /** Schema or record absent. */
    NOT_FOUND,
    /** Malformed JSON, non-object record, invalid names, rejected schema tokens. */
    INVALID_INPUT,
    /** A record field does not match its declared schema type. */
    VALIDATION_FAILED,
    /** A partial key resolved to more than one record. */
    AMBIGUOUS_KEY,
    /** A new record has no usable identity. */
    KEY_EXTRACTION_FAILED,
    /** Snapshot file could not be read or written. */
    IO_ERROR
}
