package com.trading.retention.cleanup;

/**
 * Thrown when a verified deletion finds that the store did not remove exactly the
 * records that were selected.
 */
public class DeletionVerificationException extends RuntimeException {

    private final String dataType;
    private final int expected;
    private final int actual;

    public DeletionVerificationException(String dataType, int expected, int actual) {
        super("Deletion verification failed for " + dataType
                + ": expected " + expected + " records removed, got " + actual);
        this.dataType = dataType;
        this.expected = expected;
        this.actual = actual;
    }

    public DeletionVerificationException(String dataType, int expected, int actual, String message) {
        super(message);
        this.dataType = dataType;
        this.expected = expected;
        this.actual = actual;
    }

    public String getDataType() {
        return dataType;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
