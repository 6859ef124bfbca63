package com.umitunal.sendlater.delivery;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class ConversationPage {
    private final List<Conversation> items;
    private final int totalCount;

    public ConversationPage(List<Conversation> items, int totalCount) {
        this.items = List.copyOf(items);
        this.totalCount = totalCount;
    }

    @JsonProperty("items")
    public List<Conversation> getItems() { return items; }

    @JsonProperty("total_count")
    public int getTotalCount() { return totalCount; }
}
