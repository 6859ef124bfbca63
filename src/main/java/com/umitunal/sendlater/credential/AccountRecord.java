package com.umitunal.sendlater.credential;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stored account row. The token is kept encrypted; the secret only as a digest.
 */
public class AccountRecord {
    private final String ownerId;
    private final byte[] secretDigest;
    private final String encryptedToken;
    private final long linkedAt;

    @JsonCreator
    public AccountRecord(@JsonProperty("owner_id") String ownerId,
                         @JsonProperty("secret_digest") byte[] secretDigest,
                         @JsonProperty("encrypted_token") String encryptedToken,
                         @JsonProperty("linked_at") long linkedAt) {
        this.ownerId = ownerId;
        this.secretDigest = secretDigest;
        this.encryptedToken = encryptedToken;
        this.linkedAt = linkedAt;
    }

    @JsonProperty("owner_id")
    public String getOwnerId() { return ownerId; }

    @JsonProperty("secret_digest")
    public byte[] getSecretDigest() { return secretDigest; }

    @JsonProperty("encrypted_token")
    public String getEncryptedToken() { return encryptedToken; }

    @JsonProperty("linked_at")
    public long getLinkedAt() { return linkedAt; }
}
