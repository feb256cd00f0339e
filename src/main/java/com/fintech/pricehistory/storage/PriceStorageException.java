package com.fintech.pricehistory.storage;

/**
 * Persistence failure, carrying the operation and instrument that failed.
 */
public class PriceStorageException extends RuntimeException {

    private final String operation;
    private final String instrument;

    public PriceStorageException(String operation, String instrument, Throwable cause) {
        super(String.format("Storage operation '%s' failed for instrument %s", operation, instrument), cause);
        this.operation = operation;
        this.instrument = instrument;
    }

    public String getOperation() {
        return operation;
    }

    public String getInstrument() {
        return instrument;
    }
}
