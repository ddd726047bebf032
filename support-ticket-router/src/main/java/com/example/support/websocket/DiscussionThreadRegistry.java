package com.example.support.websocket;

import com.example.support.service.RedisKeyFactory;
import com.example.support.transport.TransportBadRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RLock;
import org.redisson.api.RMap;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.stereotype.Component;

/**
 * Discussion threads of the staff groups, kept in Redis so thread ids survive restarts.
 */
@Component
@RequiredArgsConstructor
public class DiscussionThreadRegistry {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DiscussionThread create(String groupId, String title) {
        long threadId = redissonClient.getAtomicLong(keyFactory.threadSequenceKey(groupId)).incrementAndGet();
        DiscussionThread thread = DiscussionThread.builder()
                .threadId(threadId)
                .groupId(groupId)
                .title(title)
                .closed(false)
                .createdAt(clock.instant())
                .build();
        threads(groupId).fastPut(threadId, thread);
        return thread;
    }

    public Optional<DiscussionThread> find(String groupId, long threadId) {
        return Optional.ofNullable(threads(groupId).get(threadId));
    }

    public DiscussionThread require(String groupId, long threadId) {
        return find(groupId, threadId)
                .orElseThrow(() -> new TransportBadRequestException("Unknown thread %d".formatted(threadId)));
    }

    /**
     * Returns the thread if it exists and accepts messages from participants.
     */
    public DiscussionThread requireOpen(String groupId, long threadId) {
        DiscussionThread thread = require(groupId, threadId);
        if (thread.isClosed()) {
            throw new TransportBadRequestException("Thread %d is closed".formatted(threadId));
        }
        return thread;
    }

    public DiscussionThread setClosed(String groupId, long threadId, boolean closed) {
        RLock lock = redissonClient.getLock(keyFactory.threadMapKey(groupId) + ":lock:" + threadId);
        lock.lock();
        try {
            DiscussionThread thread = find(groupId, threadId)
                    .orElseThrow(() -> new TransportBadRequestException("Unknown thread %d".formatted(threadId)));
            if (thread.isClosed() == closed) {
                throw new TransportBadRequestException(
                        "Thread %d is already %s".formatted(threadId, closed ? "closed" : "open"));
            }
            thread.setClosed(closed);
            threads(groupId).fastPut(threadId, thread);
            return thread;
        } finally {
            lock.unlock();
        }
    }

    private RMap<Long, DiscussionThread> threads(String groupId) {
        return redissonClient.getMap(keyFactory.threadMapKey(groupId),
                new TypedJsonJacksonCodec(Long.class, DiscussionThread.class, objectMapper));
    }
}
