package com.umitunal.sendlater.credential;

import java.util.Optional;

/**
 * Maps client secrets to accounts and accounts to their decrypted upstream token.
 * Implementations must allow concurrent readers.
 */
public interface CredentialStore {

    /**
     * Store or replace the upstream token of an account and issue a new client secret.
     * Any previous secret of the account stops working.
     *
     * @return the new client secret
     */
    String link(String ownerId, String upstreamToken) throws CredentialStoreException;

    /**
     * Find the account a client secret belongs to.
     */
    Optional<String> findOwnerBySecret(String clientSecret) throws CredentialStoreException;

    /**
     * Decrypt the current upstream token of an account.
     */
    String resolve(String ownerId) throws CredentialUnavailableException;
}
