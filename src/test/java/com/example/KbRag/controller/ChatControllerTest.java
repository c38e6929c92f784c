package com.example.KbRag.controller;

import com.example.KbRag.model.ChatRequest;
import com.example.KbRag.model.ThinkingEvent;
import com.example.KbRag.service.ChatAnswerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import reactor.core.publisher.Flux;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    @Mock
    private ChatAnswerService chatAnswerService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new ChatController(chatAnswerService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void blankStreamQuestionIsBadRequest() throws Exception {
        when(chatAnswerService.streamAnswer(any(ChatRequest.class)))
                .thenThrow(new IllegalArgumentException("Question must not be empty"));

        mvc.perform(post("/api/chat/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content("{\"question\": \"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void validStreamQuestionStartsAsyncResponse() throws Exception {
        when(chatAnswerService.streamAnswer(any(ChatRequest.class)))
                .thenReturn(Flux.just(new ThinkingEvent("start", "Requête reçue.", "s1")));

        mvc.perform(post("/api/chat/stream")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .content("{\"question\": \"Chantier de type D ?\", \"sessionId\": \"s1\"}"))
                .andExpect(request().asyncStarted());
    }

    @Test
    void blankAnswerQuestionIsBadRequestWithJsonBody() throws Exception {
        when(chatAnswerService.answer(any(ChatRequest.class)))
                .thenThrow(new IllegalArgumentException("Question must not be empty"));

        mvc.perform(post("/api/chat/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Question must not be empty"));
    }
}
