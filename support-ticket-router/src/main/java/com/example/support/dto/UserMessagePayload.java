package com.example.support.dto;

import lombok.Data;

@Data
public class UserMessagePayload {

    private String text;

    private String caption;

    private String mediaType;

    /**
     * Set when the user shares a contact card instead of text.
     */
    private String contactPhone;

    private String contactOwnerId;

    private Long replyToMessageId;
}
