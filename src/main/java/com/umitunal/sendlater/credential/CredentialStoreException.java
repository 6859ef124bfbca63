package com.umitunal.sendlater.credential;

/**
 * I/O failure of the credential store.
 */
public class CredentialStoreException extends Exception {

    public CredentialStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
