package com.example.support.service;

import com.example.support.config.SupportProperties;
import com.example.support.domain.ConversationState;
import com.example.support.domain.ConversationStep;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryConversationStateStore")
class InMemoryConversationStateStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private InMemoryConversationStateStore store;

    @BeforeEach
    void setUp() {
        SupportProperties properties = new SupportProperties();
        properties.getIntake().setStateTtl(Duration.ofMinutes(30));
        store = new InMemoryConversationStateStore(properties, clock);
    }

    @Test
    @DisplayName("Should return the saved state until it expires")
    void shouldExpireAbandonedState() {
        store.save(ConversationState.start("u1", ConversationStep.CATEGORY_SELECTION));

        clock.advance(Duration.ofMinutes(29));
        assertThat(store.find("u1")).map(ConversationState::getStep).contains(ConversationStep.CATEGORY_SELECTION);

        clock.advance(Duration.ofMinutes(1));
        assertThat(store.find("u1")).isEmpty();
    }

    @Test
    @DisplayName("Should restart the lifetime on every save")
    void shouldRefreshOnSave() {
        ConversationState state = ConversationState.start("u1", ConversationStep.CATEGORY_SELECTION);
        store.save(state);
        clock.advance(Duration.ofMinutes(20));
        state.setStep(ConversationStep.DESCRIPTION_ENTRY);
        store.save(state);

        clock.advance(Duration.ofMinutes(20));

        assertThat(store.find("u1")).map(ConversationState::getStep).contains(ConversationStep.DESCRIPTION_ENTRY);
    }

    @Test
    @DisplayName("Should evict abandoned conversations that are never looked up again")
    void shouldEvictWithoutLookup() {
        store.save(ConversationState.start("u1", ConversationStep.AWAITING_IDENTITY));
        store.save(ConversationState.start("u2", ConversationStep.AWAITING_IDENTITY));

        clock.advance(Duration.ofMinutes(31));
        store.save(ConversationState.start("u3", ConversationStep.CATEGORY_SELECTION));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.find("u3")).isPresent();
    }

    @Test
    @DisplayName("Should forget a cleared conversation")
    void shouldClear() {
        store.save(ConversationState.start("u1", ConversationStep.DESCRIPTION_ENTRY));
        store.save(ConversationState.start("u2", ConversationStep.DESCRIPTION_ENTRY));

        store.clear("u1");

        assertThat(store.find("u1")).isEmpty();
        assertThat(store.find("u2")).isPresent();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
