package com.example.LlmCouncil.controller;

import com.example.LlmCouncil.model.Conversation;
import com.example.LlmCouncil.model.ConversationSummary;
import com.example.LlmCouncil.model.MessageRequest;
import com.example.LlmCouncil.model.SettlementLog;
import com.example.LlmCouncil.model.StageEvent;
import com.example.LlmCouncil.service.ConversationService;
import com.example.LlmCouncil.service.CouncilPipeline;
import com.example.LlmCouncil.service.SettlementLogService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.util.List;

@Tag(name = "conversations")
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
public class ConversationController {

    private final ConversationService conversationService;
    private final CouncilPipeline councilPipeline;
    private final SettlementLogService settlementLogService;

    @GetMapping
    public List<ConversationSummary> list() {
        return conversationService.list();
    }

    @PostMapping
    public Conversation create() {
        return conversationService.create();
    }

    @GetMapping("/{conversationId}")
    public Conversation get(@PathVariable String conversationId) {
        return conversationService.get(conversationId).rounded();
    }

    @GetMapping("/{conversationId}/settlements")
    public List<SettlementLog> settlements(@PathVariable String conversationId) {
        conversationService.get(conversationId);
        return settlementLogService.history(conversationId);
    }

    /**
     * Runs the whole council and returns every stage event once the run has ended.
     */
    @PostMapping("/{conversationId}/message")
    public List<StageEvent> sendMessage(@PathVariable String conversationId, @RequestBody MessageRequest request) {
        List<StageEvent> events = councilPipeline.submit(conversationId, request.resolveContent())
                .collectList()
                .block();
        return events == null ? List.of() : events;
    }

    @PostMapping(value = "/{conversationId}/message/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter sendMessageStream(@PathVariable String conversationId, @RequestBody MessageRequest request) {
        // Busy and unknown conversations fail here, before the stream is opened
        return bridge(councilPipeline.submit(conversationId, request.resolveContent()));
    }

    @PostMapping(value = "/{conversationId}/resume/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter resumeStream(@PathVariable String conversationId) {
        return bridge(councilPipeline.resume(conversationId));
    }

    private SseEmitter bridge(Flux<StageEvent> events) {
        // 0L means no timeout; a council run can take several minutes
        SseEmitter emitter = new SseEmitter(0L);

        Disposable subscription = events.subscribe(
                event -> {
                    try {
                        // Event type as SSE event name so the frontend can handle each stage separately
                        emitter.send(
                                SseEmitter.event()
                                        .name(event.type())
                                        .data(event)
                        );
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        // Disposing only flags the run; the in-flight stage still completes and is checkpointed
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return emitter;
    }
}
