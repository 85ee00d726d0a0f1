package me.golemcore.roundtable.domain.service;

import me.golemcore.roundtable.domain.conversation.Conversation;
import me.golemcore.roundtable.domain.conversation.TerminationPolicy;
import me.golemcore.roundtable.domain.conversation.selection.RoundRobinSelectionPolicy;
import me.golemcore.roundtable.domain.model.ConversationOutcome;
import me.golemcore.roundtable.domain.model.ConversationState;
import me.golemcore.roundtable.domain.model.OracleUnavailableException;
import me.golemcore.roundtable.domain.model.SpeakerDefinition;
import me.golemcore.roundtable.domain.model.StopReason;
import me.golemcore.roundtable.domain.model.TranscriptEntry;
import me.golemcore.roundtable.domain.model.Turn;
import me.golemcore.roundtable.port.outbound.TextOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConversationServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-01T10:00:00Z");

    private TextOracle textOracle;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        textOracle = mock(TextOracle.class);
        service = new ConversationService(textOracle, new ConversationRunner(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Conversation createNarratorHero() {
        return service.create(List.of(
                new SpeakerDefinition("N", "You narrate."),
                new SpeakerDefinition("H", "You are the hero.")), new RoundRobinSelectionPolicy());
    }

    // ===== create =====

    @Test
    void shouldCreateUnseededConversation() {
        Conversation conversation = createNarratorHero();

        assertNotNull(conversation.getId());
        assertEquals(NOW, conversation.getCreatedAt());
        assertEquals(ConversationState.UNSEEDED, conversation.getOrchestrator().getState());
        assertEquals(List.of("N", "H"), conversation.getOrchestrator().getRoster().stream()
                .map(speaker -> speaker.getIdentity()).toList());
        assertTrue(service.find(conversation.getId()).isPresent());
    }

    @Test
    void shouldDefaultMissingDirectiveToEmpty() {
        Conversation conversation = service.create(List.of(new SpeakerDefinition("A", null)),
                new RoundRobinSelectionPolicy());

        assertEquals("", conversation.getOrchestrator().getRoster().get(0).getDirective());
    }

    @Test
    void shouldRejectInvalidRosters() {
        RoundRobinSelectionPolicy policy = new RoundRobinSelectionPolicy();
        List<SpeakerDefinition> empty = List.of();
        List<SpeakerDefinition> blank = List.of(new SpeakerDefinition(" ", "d"));
        List<SpeakerDefinition> duplicate = List.of(new SpeakerDefinition("A", "x"), new SpeakerDefinition("A", "y"));

        assertThrows(IllegalArgumentException.class, () -> service.create(empty, policy));
        assertThrows(IllegalArgumentException.class, () -> service.create(blank, policy));
        assertThrows(IllegalArgumentException.class, () -> service.create(duplicate, policy));
        assertTrue(service.list().isEmpty());
    }

    // ===== prime / advance =====

    @Test
    void shouldPrimeAndAdvance() {
        Conversation conversation = createNarratorHero();
        when(textOracle.generate(eq("You are the hero."), anyString())).thenReturn("I go north.");

        service.prime(conversation.getId(), "N", "Begin the quest.");
        Turn turn = service.advance(conversation.getId());

        assertEquals(new Turn(0, "H", "I go north."), turn);
        List<TranscriptEntry> expected = List.of(
                TranscriptEntry.of("N", "Begin the quest."),
                TranscriptEntry.of("H", "I go north."));
        assertEquals(expected, service.transcriptOf(conversation.getId(), "N").orElseThrow());
        assertEquals(expected, service.transcriptOf(conversation.getId(), "H").orElseThrow());
    }

    @Test
    void shouldRejectSecondPrime() {
        Conversation conversation = createNarratorHero();
        String id = conversation.getId();
        service.prime(id, "N", "Begin.");

        assertThrows(IllegalStateException.class, () -> service.prime(id, "N", "Again."));
        assertEquals(1, conversation.getOrchestrator().getTranscript().size());
    }

    @Test
    void shouldRejectBlankInitiator() {
        String id = createNarratorHero().getId();

        assertThrows(IllegalArgumentException.class, () -> service.prime(id, "", "Begin."));
    }

    @Test
    void shouldRejectAdvanceBeforePrime() {
        String id = createNarratorHero().getId();

        assertThrows(IllegalStateException.class, () -> service.advance(id));
        verifyNoInteractions(textOracle);
    }

    @Test
    void shouldSurfaceOracleFailureUnchanged() {
        Conversation conversation = createNarratorHero();
        String id = conversation.getId();
        service.prime(id, "N", "Begin.");
        when(textOracle.generate(anyString(), anyString())).thenThrow(new OracleUnavailableException("down"));

        assertThrows(OracleUnavailableException.class, () -> service.advance(id));
        assertEquals(0, conversation.getOrchestrator().getTurnIndex());
        assertEquals(1, service.transcriptOf(id, "H").orElseThrow().size());
    }

    // ===== run =====

    @Test
    void shouldRunUntilTurnBudget() {
        Conversation conversation = createNarratorHero();
        when(textOracle.generate(anyString(), anyString())).thenReturn("line");
        service.prime(conversation.getId(), "N", "Begin.");

        ConversationOutcome outcome = service.run(conversation.getId(), TerminationPolicy.maxTurns(4), 0, turn -> {
        });

        assertEquals(StopReason.TURN_BUDGET, outcome.getStopReason());
        assertEquals(4, conversation.getOrchestrator().getTurnIndex());
        int transcriptLength = service.inspect(conversation.getId(),
                c -> c.getOrchestrator().getTranscript().size());
        assertEquals(5, transcriptLength);
    }

    @Test
    void shouldRejectRunBeforePrime() {
        String id = createNarratorHero().getId();
        TerminationPolicy termination = TerminationPolicy.maxTurns(1);

        assertThrows(IllegalStateException.class, () -> service.run(id, termination, 0, turn -> {
        }));
    }

    // ===== lookup =====

    @Test
    void shouldRejectUnknownConversationAndSpeaker() {
        String id = createNarratorHero().getId();

        assertThrows(IllegalArgumentException.class, () -> service.advance("missing"));
        assertTrue(service.transcriptOf(id, "Villain").isEmpty());
        assertTrue(service.find("missing").isEmpty());
    }

    @Test
    void shouldListInCreationOrderAndDelete() {
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW, NOW.plusSeconds(5));
        ConversationService timed = new ConversationService(textOracle, new ConversationRunner(), clock);
        Conversation first = timed.create(List.of(new SpeakerDefinition("A", "")), new RoundRobinSelectionPolicy());
        Conversation second = timed.create(List.of(new SpeakerDefinition("B", "")), new RoundRobinSelectionPolicy());

        assertEquals(List.of(first, second), timed.list());
        assertTrue(timed.delete(first.getId()));
        assertFalse(timed.delete(first.getId()));
        assertEquals(List.of(second), timed.list());
    }

    // ===== isolation =====

    @Test
    void shouldKeepIndependentConversationsIsolated() throws Exception {
        when(textOracle.generate(anyString(), anyString())).thenReturn("reply");
        Conversation left = createNarratorHero();
        Conversation right = createNarratorHero();
        service.prime(left.getId(), "N", "Left.");
        service.prime(right.getId(), "N", "Right.");

        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?> a = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 20; i++) {
                    service.advance(left.getId());
                }
                return null;
            });
            Future<?> b = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 10; i++) {
                    service.advance(right.getId());
                }
                return null;
            });
            start.countDown();
            a.get(10, TimeUnit.SECONDS);
            b.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(20, left.getOrchestrator().getTurnIndex());
        assertEquals(10, right.getOrchestrator().getTurnIndex());
        assertTrue(left.getOrchestrator().transcriptsConverged());
        assertTrue(right.getOrchestrator().transcriptsConverged());
        assertEquals(TranscriptEntry.of("N", "Right."), right.getOrchestrator().getTranscript().get(0));
    }
}
