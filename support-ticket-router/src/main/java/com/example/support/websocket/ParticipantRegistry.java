package com.example.support.websocket;

import com.example.support.service.RedisKeyFactory;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RSet;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Component;

/**
 * Who may receive messages: identities that blocked the bot, identities connected as bots, and the
 * shared message id sequence.
 */
@Component
@RequiredArgsConstructor
public class ParticipantRegistry {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;

    public long nextMessageId() {
        return redissonClient.getAtomicLong(keyFactory.messageSequenceKey()).incrementAndGet();
    }

    public void setBlocked(String identity, boolean blocked) {
        if (blocked) {
            blocked().add(identity);
        } else {
            blocked().remove(identity);
        }
    }

    public boolean isBlocked(String identity) {
        return blocked().contains(identity);
    }

    public void registerBot(String identity) {
        bots().add(identity);
    }

    public boolean isBot(String identity) {
        return bots().contains(identity);
    }

    private RSet<String> blocked() {
        return redissonClient.getSet(keyFactory.blockedIdentitiesKey(), StringCodec.INSTANCE);
    }

    private RSet<String> bots() {
        return redissonClient.getSet(keyFactory.botIdentitiesKey(), StringCodec.INSTANCE);
    }
}
