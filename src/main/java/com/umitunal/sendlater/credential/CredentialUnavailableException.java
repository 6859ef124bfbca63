package com.umitunal.sendlater.credential;

/**
 * The owner's upstream credential cannot be produced.
 */
public class CredentialUnavailableException extends Exception {

    public enum Reason {
        NOT_FOUND,
        DECRYPTION_FAILED,
        STORAGE_ERROR
    }

    private final Reason reason;

    public CredentialUnavailableException(Reason reason, String message) {
        this(reason, message, null);
    }

    public CredentialUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
