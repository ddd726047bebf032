package com.example.support.transport;

public enum EventOrigin {
    USER,
    STAFF
}
