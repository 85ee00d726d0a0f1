package me.golemcore.roundtable.domain.service;

import me.golemcore.roundtable.domain.conversation.Orchestrator;
import me.golemcore.roundtable.domain.conversation.Speaker;
import me.golemcore.roundtable.domain.conversation.TerminationPolicy;
import me.golemcore.roundtable.domain.model.ConversationOutcome;
import me.golemcore.roundtable.domain.model.OracleUnavailableException;
import me.golemcore.roundtable.domain.model.StopReason;
import me.golemcore.roundtable.domain.model.Turn;
import me.golemcore.roundtable.port.outbound.TextOracle;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConversationRunnerTest {

    private final ConversationRunner runner = new ConversationRunner();

    private static Orchestrator orchestrator(TextOracle oracle) {
        Orchestrator orchestrator = new Orchestrator(List.of(
                new Speaker("Narrator", "narrate", oracle),
                new Speaker("Hero", "act", oracle)));
        orchestrator.prime("Narrator", "Begin the quest.");
        return orchestrator;
    }

    @Test
    void shouldStopAtTurnBudget() {
        AtomicInteger counter = new AtomicInteger();
        Orchestrator orchestrator = orchestrator((directive, content) -> "line " + counter.incrementAndGet());
        List<Turn> observed = new ArrayList<>();

        ConversationOutcome outcome = runner.run(orchestrator, TerminationPolicy.maxTurns(3), 0, observed::add);

        assertEquals(StopReason.TURN_BUDGET, outcome.getStopReason());
        assertEquals(3, outcome.getTurnsCompleted());
        assertEquals(outcome.getTurns(), observed);
        assertEquals(List.of("Hero", "Narrator", "Hero"),
                observed.stream().map(Turn::getIdentity).toList());
        assertEquals(3, orchestrator.getTurnIndex());
        assertNull(outcome.getFailure());
    }

    @Test
    void shouldRunNoTurnsForZeroBudget() {
        Orchestrator orchestrator = orchestrator((directive, content) -> {
            throw new AssertionError("oracle must not be called");
        });

        ConversationOutcome outcome = runner.run(orchestrator, TerminationPolicy.maxTurns(0), 0, turn -> {
        });

        assertEquals(StopReason.TURN_BUDGET, outcome.getStopReason());
        assertEquals(0, outcome.getTurnsCompleted());
    }

    @Test
    void shouldStopOnStopPhrase() {
        AtomicInteger counter = new AtomicInteger();
        Orchestrator orchestrator = orchestrator(
                (directive, content) -> counter.incrementAndGet() == 2 ? "And that is THE END." : "More.");

        ConversationOutcome outcome = runner.run(orchestrator,
                TerminationPolicy.anyOf(TerminationPolicy.stopPhrase("the end"), TerminationPolicy.maxTurns(10)),
                0, turn -> {
                });

        assertEquals(StopReason.STOP_PHRASE, outcome.getStopReason());
        assertEquals(2, outcome.getTurnsCompleted());
        assertEquals("Narrator", outcome.getTurns().get(1).getIdentity());
    }

    @Test
    void shouldRetryFailedTurnAndContinue() {
        AtomicInteger counter = new AtomicInteger();
        Orchestrator orchestrator = orchestrator((directive, content) -> {
            if (counter.incrementAndGet() == 2) {
                throw new OracleUnavailableException("transient");
            }
            return "ok " + counter.get();
        });

        ConversationOutcome outcome = runner.run(orchestrator, TerminationPolicy.maxTurns(2), 1, turn -> {
        });

        assertEquals(StopReason.TURN_BUDGET, outcome.getStopReason());
        assertEquals(List.of(new Turn(0, "Hero", "ok 1"), new Turn(1, "Narrator", "ok 3")), outcome.getTurns());
        assertTrue(orchestrator.transcriptsConverged());
        assertEquals(3, orchestrator.getTranscript().size());
    }

    @Test
    void shouldReportOracleUnavailableWhenRetriesExhausted() {
        AtomicInteger attempts = new AtomicInteger();
        Orchestrator orchestrator = orchestrator((directive, content) -> {
            if (attempts.incrementAndGet() > 1) {
                throw new OracleUnavailableException("down");
            }
            return "first";
        });

        ConversationOutcome outcome = runner.run(orchestrator, TerminationPolicy.maxTurns(5), 2, turn -> {
        });

        assertEquals(StopReason.ORACLE_UNAVAILABLE, outcome.getStopReason());
        assertEquals(1, outcome.getTurnsCompleted());
        assertEquals("down", outcome.getFailure().getMessage());
        assertEquals(4, attempts.get());
        assertEquals(1, orchestrator.getTurnIndex());
        assertEquals(2, orchestrator.getTranscript().size());
    }

    @Test
    void shouldRejectNegativeRetries() {
        Orchestrator orchestrator = orchestrator((directive, content) -> "x");
        TerminationPolicy termination = TerminationPolicy.maxTurns(1);

        assertThrows(IllegalArgumentException.class, () -> runner.run(orchestrator, termination, -1, turn -> {
        }));
    }
}
