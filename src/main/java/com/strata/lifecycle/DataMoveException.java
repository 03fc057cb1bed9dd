package com.strata.lifecycle;

/**
 * Thrown when a data move aborts. Carries the number of records read from
 * the source before the failure.
 */
public class DataMoveException extends RuntimeException {
    
    private final long recordsRead;
    
    public DataMoveException(String message, long recordsRead, Throwable cause) {
        super(message, cause);
        this.recordsRead = recordsRead;
    }
    
    public long getRecordsRead() {
        return recordsRead;
    }
    
    @Override
    public String getMessage() {
        return super.getMessage() + " [Records read: " + recordsRead + "]";
    }
}
