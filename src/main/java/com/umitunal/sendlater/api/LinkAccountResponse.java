package com.umitunal.sendlater.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class LinkAccountResponse {
    private final String clientSecret;

    @JsonCreator
    public LinkAccountResponse(@JsonProperty("client_secret") String clientSecret) {
        this.clientSecret = clientSecret;
    }

    @JsonProperty("client_secret")
    public String getClientSecret() {
        return clientSecret;
    }
}
