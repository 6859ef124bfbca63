package com.umitunal.sendlater.delivery;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One dialog of the user, usable as a delivery recipient.
 */
public class Conversation {
    private final long peerId;
    private final String title;

    public Conversation(long peerId, String title) {
        this.peerId = peerId;
        this.title = title;
    }

    @JsonProperty("peer_id")
    public long getPeerId() { return peerId; }

    @JsonProperty("title")
    public String getTitle() { return title; }
}
