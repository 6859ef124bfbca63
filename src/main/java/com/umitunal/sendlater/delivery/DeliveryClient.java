package com.umitunal.sendlater.delivery;

/**
 * Sends one message to the upstream messaging service.
 */
@FunctionalInterface
public interface DeliveryClient {

    /**
     * Perform a single outbound call. Transport problems, including timeouts,
     * are reported as {@link DeliveryOutcome.Kind#TRANSPORT_FAILURE}, not thrown.
     *
     * @param credential decrypted upstream access token
     * @param recipientId numeric peer id
     * @param message text to send
     */
    DeliveryOutcome deliver(String credential, String recipientId, String message);
}
