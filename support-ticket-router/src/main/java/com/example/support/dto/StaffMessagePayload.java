package com.example.support.dto;

import lombok.Data;

@Data
public class StaffMessagePayload {

    private Long threadId;

    private String text;

    private String caption;

    private String mediaType;

    private Long replyToMessageId;
}
