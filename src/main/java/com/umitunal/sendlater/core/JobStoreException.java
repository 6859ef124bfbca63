package com.umitunal.sendlater.core;

/**
 * Failure of the job store. Plain instances signal an I/O problem and are retryable.
 */
public class JobStoreException extends Exception {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
