package com.example.support.transport;

public record ThreadHandle(long threadId, String title) {}
