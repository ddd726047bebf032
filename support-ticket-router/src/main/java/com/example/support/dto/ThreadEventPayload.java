package com.example.support.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ThreadEventPayload {

    public enum Action {
        CREATED,
        CLOSED,
        REOPENED
    }

    Action action;
    String groupId;
    long threadId;
    String title;
}
