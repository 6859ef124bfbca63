package com.umitunal.sendlater.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class LinkAccountRequest {
    private final String vkAccessToken;

    @JsonCreator
    public LinkAccountRequest(@JsonProperty("vk_access_token") String vkAccessToken) {
        this.vkAccessToken = vkAccessToken;
    }

    @JsonProperty("vk_access_token")
    public String getVkAccessToken() {
        return vkAccessToken;
    }

    @Override
    public String toString() {
        return "LinkAccountRequest{vkAccessToken=***}";
    }
}
