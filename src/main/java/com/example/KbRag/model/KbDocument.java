package com.example.KbRag.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.time.Instant;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KbDocument {
    private String id;
    private String title;
    private String source;
    private JsonNode metadata;
    private int chunkCount;
    private Instant createdAt;
}
