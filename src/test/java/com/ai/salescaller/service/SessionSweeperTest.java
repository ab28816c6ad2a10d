package com.ai.salescaller.service;

import com.ai.salescaller.config.CallerProperties;
import com.ai.salescaller.conversation.CallOutcome;
import com.ai.salescaller.conversation.CallSession;
import com.ai.salescaller.conversation.ConversationScript;
import com.ai.salescaller.conversation.CustomerProfile;
import com.ai.salescaller.conversation.CustomerRef;
import com.ai.salescaller.service.dispatch.NotificationDispatcher;
import com.ai.salescaller.service.extraction.IntentExtractor;
import com.ai.salescaller.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SessionSweeperTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-13T09:00:00Z"));
    private final SessionStore store = new SessionStore();
    private final NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);
    private SessionSweeper sweeper;

    @BeforeEach
    void setUp() {
        CallerProperties properties = new CallerProperties();
        ConversationStateMachine machine = new ConversationStateMachine(store, mock(IntentExtractor.class),
                ConversationScript.standard("Sarah"), dispatcher, properties, clock);
        sweeper = new SessionSweeper(store, machine, properties, clock);
    }

    @Test
    void shouldEndAbandonedLiveSessionAsNoResponse() {
        CallSession session = register("CA1");
        clock.advance(Duration.ofMinutes(11));

        sweeper.sweep();

        assertThat(session.isTerminal()).isTrue();
        assertThat(session.getOutcome()).isEqualTo(CallOutcome.NO_RESPONSE);
        verify(dispatcher).dispatch(session);
    }

    @Test
    void shouldEvictTerminalSessionLeftBehind() {
        CallSession session = register("CA1");
        session.terminate(CallOutcome.NOT_INTERESTED, clock.instant());
        clock.advance(Duration.ofMinutes(11));

        sweeper.sweep();

        assertThat(store.find("CA1")).isEmpty();
        assertThat(store.isFinished("CA1")).isTrue();
    }

    @Test
    void shouldForgetFinishedCallAfterRetention() {
        CallSession session = register("CA1");
        session.terminate(CallOutcome.NOT_INTERESTED, clock.instant());
        store.remove(session);
        clock.advance(Duration.ofMinutes(61));

        sweeper.sweep();

        assertThat(store.isFinished("CA1")).isFalse();
    }

    @Test
    void shouldLeaveActiveSessionsAlone() {
        CallSession session = register("CA1");
        clock.advance(Duration.ofMinutes(5));

        sweeper.sweep();

        assertThat(session.isTerminal()).isFalse();
        assertThat(store.find("CA1")).isPresent();
    }

    private CallSession register(String callId) {
        return store.getOrCreate(callId, () -> new CallSession(callId,
                new CustomerProfile(new CustomerRef("+15551230001", "CUST001"), "Alex", "Civic", "Premier Auto", null, true),
                clock.instant())).getSession();
    }
}
