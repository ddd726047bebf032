package com.example.support.transport;

import java.io.Serializable;

/**
 * A shared contact card. {@code ownerId} is the conversation identity the contact belongs to, if
 * the transport knows it.
 */
public record ContactInfo(String phone, String ownerId) implements Serializable {}
