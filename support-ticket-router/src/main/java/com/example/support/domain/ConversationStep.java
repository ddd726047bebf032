package com.example.support.domain;

public enum ConversationStep {
    AWAITING_IDENTITY,
    CATEGORY_SELECTION,
    ORDER_SELECTION,
    DESCRIPTION_ENTRY
}
