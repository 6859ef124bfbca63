package com.umitunal.sendlater.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * What a delivery job sends: the recipient peer and the message text.
 */
public class DeliveryPayload {
    private String recipientId;
    private String message;

    // Required by Kryo
    private DeliveryPayload() {
    }

    @JsonCreator
    public DeliveryPayload(@JsonProperty("recipient_id") String recipientId,
                           @JsonProperty("message") String message) {
        this.recipientId = recipientId;
        this.message = message;
    }

    @JsonProperty("recipient_id")
    public String getRecipientId() {
        return recipientId;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeliveryPayload that = (DeliveryPayload) o;
        return Objects.equals(recipientId, that.recipientId) && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recipientId, message);
    }

    @Override
    public String toString() {
        return "DeliveryPayload{recipientId='" + recipientId + "', messageLength="
                + (message == null ? 0 : message.length()) + "}";
    }
}
