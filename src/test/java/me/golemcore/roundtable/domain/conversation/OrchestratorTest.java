package me.golemcore.roundtable.domain.conversation;

import me.golemcore.roundtable.domain.conversation.selection.RoundRobinSelectionPolicy;
import me.golemcore.roundtable.domain.conversation.selection.SeededRandomSelectionPolicy;
import me.golemcore.roundtable.domain.model.ConversationState;
import me.golemcore.roundtable.domain.model.OracleUnavailableException;
import me.golemcore.roundtable.domain.model.TranscriptEntry;
import me.golemcore.roundtable.domain.model.Turn;
import me.golemcore.roundtable.port.outbound.TextOracle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class OrchestratorTest {

    private static final TextOracle ECHO = (directive, content) -> "said by " + directive;

    private static Speaker speaker(String identity) {
        return new Speaker(identity, identity, ECHO);
    }

    // ===== construction =====

    @Test
    void shouldRejectEmptyRoster() {
        List<Speaker> roster = List.of();
        assertThrows(IllegalArgumentException.class, () -> new Orchestrator(roster));
    }

    @Test
    void shouldRejectDuplicateIdentities() {
        List<Speaker> roster = List.of(speaker("A"), speaker("A"));
        assertThrows(IllegalArgumentException.class, () -> new Orchestrator(roster));
    }

    @Test
    void shouldStartUnseededAtTurnZeroWithRoundRobin() {
        Orchestrator orchestrator = new Orchestrator(List.of(speaker("A")));

        assertEquals(0, orchestrator.getTurnIndex());
        assertEquals(ConversationState.UNSEEDED, orchestrator.getState());
        assertInstanceOf(RoundRobinSelectionPolicy.class, orchestrator.getSelectionPolicy());
    }

    @Test
    void shouldKeepRosterFixedAfterConstruction() {
        List<Speaker> roster = new ArrayList<>(List.of(speaker("A"), speaker("B")));
        Orchestrator orchestrator = new Orchestrator(roster);

        roster.add(speaker("C"));

        assertEquals(2, orchestrator.getRoster().size());
        assertThrows(UnsupportedOperationException.class, () -> orchestrator.getRoster().add(speaker("D")));
    }

    // ===== prime =====

    @Test
    void shouldSeedEveryTranscriptWithNonMemberInitiator() {
        Orchestrator orchestrator = new Orchestrator(List.of(speaker("A"), speaker("B")));

        orchestrator.prime("Narrator", "Once upon a time.");

        assertEquals(ConversationState.SEEDED, orchestrator.getState());
        for (Speaker speaker : orchestrator.getRoster()) {
            assertEquals(List.of(TranscriptEntry.of("Narrator", "Once upon a time.")), speaker.getTranscript());
        }
        assertEquals(0, orchestrator.getTurnIndex());
    }

    @Test
    void shouldDoubleSeedWhenPrimedTwice() {
        Orchestrator orchestrator = new Orchestrator(List.of(speaker("A")));

        orchestrator.prime("N", "x");
        orchestrator.prime("N", "x");

        assertEquals(2, orchestrator.getTranscript().size());
    }

    // ===== selection =====

    @Test
    void shouldSelectWithPlusOneOffset() {
        Orchestrator orchestrator = new Orchestrator(List.of(speaker("A"), speaker("B"), speaker("C")));

        assertEquals(1, orchestrator.selectSpeaker(0));
        assertEquals(2, orchestrator.selectSpeaker(1));
        assertEquals(0, orchestrator.selectSpeaker(2));
        assertEquals(1, orchestrator.selectSpeaker(3));
    }

    @Test
    void shouldSelectOnlyMemberOfSingletonRoster() {
        Orchestrator orchestrator = new Orchestrator(List.of(speaker("Solo")));

        assertEquals(0, orchestrator.selectSpeaker(0));
        assertEquals(0, orchestrator.selectSpeaker(7));
    }

    @Test
    void shouldRejectPolicyReturningOutOfRangeIndex() {
        Orchestrator orchestrator = new Orchestrator(List.of(speaker("A"), speaker("B")), (turn, size) -> size);

        assertThrows(IllegalStateException.class, () -> orchestrator.selectSpeaker(0));
        assertThrows(IllegalStateException.class, orchestrator::advance);
        assertEquals(0, orchestrator.getTurnIndex());
    }

    // ===== advance =====

    @Test
    void shouldRunNarratorHeroScenario() {
        TextOracle oracle = mock(TextOracle.class);
        when(oracle.generate(eq("hero"), anyString())).thenReturn("I go north.");
        when(oracle.generate(eq("narrator"), anyString())).thenReturn("A dragon appears.");
        Speaker narrator = new Speaker("N", "narrator", oracle);
        Speaker hero = new Speaker("H", "hero", oracle);
        Orchestrator orchestrator = new Orchestrator(List.of(narrator, hero));

        orchestrator.prime("N", "Begin the quest.");
        Turn first = orchestrator.advance();

        assertEquals(new Turn(0, "H", "I go north."), first);
        List<TranscriptEntry> afterFirst = List.of(
                TranscriptEntry.of("N", "Begin the quest."),
                TranscriptEntry.of("H", "I go north."));
        assertEquals(afterFirst, narrator.getTranscript());
        assertEquals(afterFirst, hero.getTranscript());
        verify(oracle).generate("hero", "Here is the conversation so far.\nN: Begin the quest.\nH:");

        Turn second = orchestrator.advance();

        assertEquals("N", second.getIdentity());
        assertEquals(3, narrator.getTranscriptSize());
        assertEquals(3, hero.getTranscriptSize());
        assertEquals(TranscriptEntry.of("N", "A dragon appears."), narrator.getTranscript().get(2));
        assertTrue(orchestrator.transcriptsConverged());
        assertEquals(2, orchestrator.getTurnIndex());
    }

    @Test
    void shouldAlternateRoundRobinForTwoSpeakers() {
        Orchestrator orchestrator = new Orchestrator(List.of(speaker("A"), speaker("B")));
        orchestrator.prime("A", "start");

        List<String> order = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            order.add(orchestrator.advance().getIdentity());
        }

        assertEquals(List.of("B", "A", "B"), order);
    }

    @Test
    void shouldAdvanceWithoutPriming() {
        Orchestrator orchestrator = new Orchestrator(List.of(speaker("A"), speaker("B")));

        Turn turn = orchestrator.advance();

        assertEquals("B", turn.getIdentity());
        assertEquals(List.of(TranscriptEntry.of("B", "said by B")), orchestrator.getTranscript());
        assertEquals(ConversationState.UNSEEDED, orchestrator.getState());
    }

    @Test
    void shouldBroadcastToAuthorToo() {
        Speaker solo = speaker("Solo");
        Orchestrator orchestrator = new Orchestrator(List.of(solo));
        orchestrator.prime("N", "go");

        orchestrator.advance();

        assertEquals(TranscriptEntry.of("Solo", "said by Solo"), solo.getTranscript().get(1));
    }

    @Test
    void shouldLeaveStateUntouchedWhenOracleFails() {
        AtomicInteger calls = new AtomicInteger();
        TextOracle flaky = (directive, content) -> {
            if (calls.incrementAndGet() == 2) {
                throw new OracleUnavailableException("rate limited");
            }
            return "line " + calls.get();
        };
        Speaker a = new Speaker("A", "a", flaky);
        Speaker b = new Speaker("B", "b", flaky);
        Orchestrator orchestrator = new Orchestrator(List.of(a, b));
        orchestrator.prime("N", "Begin.");
        orchestrator.advance();
        assertEquals(1, orchestrator.getTurnIndex());
        List<TranscriptEntry> beforeA = a.getTranscript();
        List<TranscriptEntry> beforeB = b.getTranscript();

        assertThrows(OracleUnavailableException.class, orchestrator::advance);

        assertEquals(1, orchestrator.getTurnIndex());
        assertEquals(beforeA, a.getTranscript());
        assertEquals(beforeB, b.getTranscript());

        Turn retried = orchestrator.advance();
        assertEquals(new Turn(1, "A", "line 3"), retried);
        assertEquals(2, orchestrator.getTurnIndex());
        assertTrue(orchestrator.transcriptsConverged());
    }

    @Test
    void shouldPropagateFailureWithoutModification() {
        OracleUnavailableException failure = new OracleUnavailableException("timeout");
        TextOracle broken = (directive, content) -> {
            throw failure;
        };
        Orchestrator orchestrator = new Orchestrator(List.of(new Speaker("A", "a", broken)));

        OracleUnavailableException thrown = assertThrows(OracleUnavailableException.class, orchestrator::advance);

        assertSame(failure, thrown);
    }

    @Test
    void shouldRefuseToAdvancePastLastTurnIndex() {
        TextOracle oracle = mock(TextOracle.class);
        Speaker a = new Speaker("A", "a", oracle);
        Speaker b = new Speaker("B", "b", oracle);
        Orchestrator orchestrator = new Orchestrator(List.of(a, b));
        orchestrator.prime("N", "Begin.");
        ReflectionTestUtils.setField(orchestrator, "turnIndex", Integer.MAX_VALUE);

        assertEquals(0, orchestrator.selectSpeaker(Integer.MAX_VALUE));
        assertThrows(IllegalStateException.class, orchestrator::advance);

        assertEquals(Integer.MAX_VALUE, orchestrator.getTurnIndex());
        assertEquals(1, a.getTranscriptSize());
        verify(oracle, never()).generate(anyString(), anyString());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 5 })
    void shouldKeepTranscriptsConvergedForAnyRosterSize(int rosterSize) {
        List<Speaker> roster = new ArrayList<>();
        for (int i = 0; i < rosterSize; i++) {
            roster.add(speaker("S" + i));
        }
        Orchestrator orchestrator = new Orchestrator(roster);
        orchestrator.prime("Seed", "opening");

        for (int turn = 1; turn <= 7; turn++) {
            Turn produced = orchestrator.advance();
            assertTrue(orchestrator.transcriptsConverged());
            assertEquals(turn + 1, orchestrator.getTranscript().size());
            assertEquals(TranscriptEntry.of("Seed", "opening"), orchestrator.getTranscript().get(0));
            assertEquals(TranscriptEntry.of(produced.getIdentity(), produced.getText()),
                    orchestrator.getTranscript().get(turn));
            assertEquals(turn, orchestrator.getTurnIndex());
        }
    }

    @Test
    void shouldReplaySameOrderForSameSeed() {
        List<String> first = speakingOrder(new SeededRandomSelectionPolicy(42L));
        List<String> second = speakingOrder(new SeededRandomSelectionPolicy(42L));

        assertEquals(first, second);
    }

    @Test
    void shouldFindSpeakerByIdentity() {
        Orchestrator orchestrator = new Orchestrator(List.of(speaker("A"), speaker("B")));

        assertEquals("B", orchestrator.findSpeaker("B").orElseThrow().getIdentity());
        assertTrue(orchestrator.findSpeaker("Z").isEmpty());
    }

    private List<String> speakingOrder(SeededRandomSelectionPolicy policy) {
        Orchestrator orchestrator = new Orchestrator(
                List.of(speaker("A"), speaker("B"), speaker("C"), speaker("D")), policy);
        orchestrator.prime("N", "go");
        List<String> order = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            order.add(orchestrator.advance().getIdentity());
        }
        return order;
    }
}
