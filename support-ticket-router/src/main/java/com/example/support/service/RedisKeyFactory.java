package com.example.support.service;

import com.example.support.config.SupportProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final SupportProperties supportProperties;

    public RedisKeyFactory(SupportProperties supportProperties) {
        this.supportProperties = supportProperties;
    }

    private String prefix() {
        return supportProperties.getRedis().getKeyPrefix();
    }

    public String conversationStateMapKey() {
        return "%s:conversation:state".formatted(prefix());
    }

    public String threadSequenceKey(String groupId) {
        return "%s:group:%s:thread-seq".formatted(prefix(), groupId);
    }

    public String threadMapKey(String groupId) {
        return "%s:group:%s:threads".formatted(prefix(), groupId);
    }

    public String messageSequenceKey() {
        return "%s:message-seq".formatted(prefix());
    }

    public String blockedIdentitiesKey() {
        return "%s:blocked".formatted(prefix());
    }

    public String botIdentitiesKey() {
        return "%s:bots".formatted(prefix());
    }

    public String socketSessionMapKey() {
        return "%s:socket:sessions".formatted(prefix());
    }
}
