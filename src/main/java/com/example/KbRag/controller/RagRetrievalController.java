package com.example.KbRag.controller;

import com.example.KbRag.model.RagQueryRequest;
import com.example.KbRag.model.RagRetrievalResult;
import com.example.KbRag.service.RagRetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rag")
@RequiredArgsConstructor
public class RagRetrievalController {

    private final RagRetrievalService ragRetrievalService;

    /**
     * Simple mode, configured defaults for limit and threshold:
     *   GET /api/rag/retrieve?q=xxx
     */
    @GetMapping("/retrieve")
    public RagRetrievalResult retrieveByQueryParam(@RequestParam("q") String question) {
        return ragRetrievalService.retrieve(new RagQueryRequest(question, null, null));
    }

    /**
     * Advanced mode:
     *   POST /api/rag/retrieve
     *   {
     *     "question": "xxx",
     *     "limit": 10,
     *     "minScore": 0.3
     *   }
     */
    @PostMapping("/retrieve")
    public RagRetrievalResult retrieveByBody(@RequestBody RagQueryRequest request) {
        return ragRetrievalService.retrieve(request);
    }
}
