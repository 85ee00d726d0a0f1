package me.golemcore.roundtable.adapter.inbound.web.controller;

import me.golemcore.roundtable.adapter.inbound.web.dto.ConversationDetailDto;
import me.golemcore.roundtable.adapter.inbound.web.dto.ConversationSummaryDto;
import me.golemcore.roundtable.adapter.inbound.web.dto.CreateConversationRequest;
import me.golemcore.roundtable.adapter.inbound.web.dto.PrimeRequest;
import me.golemcore.roundtable.adapter.inbound.web.dto.SpeakerDto;
import me.golemcore.roundtable.adapter.inbound.web.dto.TranscriptEntryDto;
import me.golemcore.roundtable.adapter.inbound.web.dto.TurnDto;
import me.golemcore.roundtable.domain.conversation.Conversation;
import me.golemcore.roundtable.domain.conversation.Orchestrator;
import me.golemcore.roundtable.domain.conversation.Speaker;
import me.golemcore.roundtable.domain.conversation.selection.SelectionPolicies;
import me.golemcore.roundtable.domain.conversation.selection.SpeakerSelectionPolicy;
import me.golemcore.roundtable.domain.model.SpeakerDefinition;
import me.golemcore.roundtable.domain.model.TranscriptEntry;
import me.golemcore.roundtable.domain.model.Turn;
import me.golemcore.roundtable.domain.service.ConversationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Conversation endpoints: create a roster, seed it, run turns and read
 * transcripts.
 *
 * <p>
 * Turns block on the LLM and every read waits on the conversation lock, so
 * all handlers run on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
@Slf4j
public class ConversationsController {

    private final ConversationService conversationService;

    @PostMapping
    public Mono<ResponseEntity<ConversationSummaryDto>> createConversation(
            @RequestBody CreateConversationRequest request) {
        return Mono.fromCallable(() -> {
            List<SpeakerDto> speakers = request.getSpeakers() != null ? request.getSpeakers() : List.of();
            List<SpeakerDefinition> definitions = speakers.stream()
                    .map(s -> new SpeakerDefinition(s.getIdentity(), s.getDirective()))
                    .toList();
            long seed = request.getSeed() != null ? request.getSeed() : 0L;
            SpeakerSelectionPolicy policy = SelectionPolicies.byName(request.getSelection(), seed);

            Conversation conversation = conversationService.create(definitions, policy);
            ConversationSummaryDto body = conversationService.inspect(conversation.getId(), this::toSummary);
            return ResponseEntity.status(HttpStatus.CREATED).body(body);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<ResponseEntity<List<ConversationSummaryDto>>> listConversations() {
        return Mono.fromCallable(() -> {
            List<ConversationSummaryDto> dtos = conversationService.list().stream()
                    .map(c -> conversationService.inspect(c.getId(), this::toSummary))
                    .toList();
            return ResponseEntity.ok(dtos);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ConversationDetailDto>> getConversation(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            return ResponseEntity.ok(conversationService.inspect(id, this::toDetail));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{id}/speakers/{identity}/transcript")
    public Mono<ResponseEntity<List<TranscriptEntryDto>>> getSpeakerTranscript(
            @PathVariable String id, @PathVariable String identity) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            List<TranscriptEntryDto> dtos = conversationService.transcriptOf(id, identity)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Speaker not found"))
                    .stream()
                    .map(this::toEntryDto)
                    .toList();
            return ResponseEntity.ok(dtos);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/prime")
    public Mono<ResponseEntity<ConversationDetailDto>> primeConversation(
            @PathVariable String id, @RequestBody PrimeRequest request) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            if (request.getText() == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "'text' is required");
            }
            conversationService.prime(id, request.getIdentity(), request.getText());
            return ResponseEntity.ok(conversationService.inspect(id, this::toDetail));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/advance")
    public Mono<ResponseEntity<TurnDto>> advanceConversation(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            requireExists(id);
            Turn turn = conversationService.advance(id);
            return ResponseEntity.ok(TurnDto.builder()
                    .index(turn.getIndex())
                    .identity(turn.getIdentity())
                    .text(turn.getText())
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteConversation(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            if (!conversationService.delete(id)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found");
            }
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void requireExists(String id) {
        if (conversationService.find(id).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found");
        }
    }

    private ConversationSummaryDto toSummary(Conversation conversation) {
        Orchestrator orchestrator = conversation.getOrchestrator();
        return ConversationSummaryDto.builder()
                .id(conversation.getId())
                .state(orchestrator.getState().name())
                .turnIndex(orchestrator.getTurnIndex())
                .speakers(orchestrator.getRoster().stream().map(Speaker::getIdentity).toList())
                .selection(orchestrator.getSelectionPolicy().getName())
                .transcriptLength(orchestrator.getRoster().get(0).getTranscriptSize())
                .createdAt(conversation.getCreatedAt().toString())
                .build();
    }

    private ConversationDetailDto toDetail(Conversation conversation) {
        Orchestrator orchestrator = conversation.getOrchestrator();
        return ConversationDetailDto.builder()
                .id(conversation.getId())
                .state(orchestrator.getState().name())
                .turnIndex(orchestrator.getTurnIndex())
                .speakers(orchestrator.getRoster().stream()
                        .map(s -> SpeakerDto.builder()
                                .identity(s.getIdentity())
                                .directive(s.getDirective())
                                .build())
                        .toList())
                .selection(orchestrator.getSelectionPolicy().getName())
                .createdAt(conversation.getCreatedAt().toString())
                .transcript(orchestrator.getTranscript().stream().map(this::toEntryDto).toList())
                .converged(orchestrator.transcriptsConverged())
                .build();
    }

    private TranscriptEntryDto toEntryDto(TranscriptEntry entry) {
        return TranscriptEntryDto.builder()
                .identity(entry.getIdentity())
                .text(entry.getText())
                .build();
    }
}
