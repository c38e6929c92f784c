package com.example.KbRag.controller;

import com.example.KbRag.model.ChatAnswer;
import com.example.KbRag.model.ChatRequest;
import com.example.KbRag.model.ThinkingEvent;
import com.example.KbRag.service.ChatAnswerService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final ChatAnswerService chatAnswerService;

    @PostMapping("/answer")
    public ChatAnswer answer(@RequestBody ChatRequest request) {
        return chatAnswerService.answer(request);
    }

    /**
     * An invalid request is refused with a bare 400 before any event is sent:
     * a JSON error body cannot be written to a text/event-stream response.
     */
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> stream(@RequestBody ChatRequest request) {
        Flux<ThinkingEvent> stream;
        try {
            stream = chatAnswerService.streamAnswer(request);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected stream request: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        }

        // the service enforces the request timeout and always ends the stream
        SseEmitter emitter = new SseEmitter(0L);

        Disposable subscription = stream.subscribe(
                event -> {
                    try {
                        // stage as SSE event name so the client can handle each stage separately
                        emitter.send(SseEmitter.event()
                                .name(event.stage())
                                .data(event));
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());

        return ResponseEntity.ok(emitter);
    }
}
