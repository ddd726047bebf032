package com.example.support.transport;

public record MessageHandle(long messageId, String chatId) {}
