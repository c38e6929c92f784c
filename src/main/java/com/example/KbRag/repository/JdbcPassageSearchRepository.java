package com.example.KbRag.repository;

import com.example.KbRag.model.HybridSearchRequest;
import com.example.KbRag.model.KbDocument;
import com.example.KbRag.model.PassageMetadata;
import com.example.KbRag.model.RetrievedPassage;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Calls the {@code hybrid_search} and {@code match_chunks} SQL functions from {@code db/schema.sql}.
 * pgvector's cosine distance is turned into similarity = 1 - distance on the database side.
 */
@Repository
@RequiredArgsConstructor
public class JdbcPassageSearchRepository implements PassageSearchRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPassageSearchRepository.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public List<RetrievedPassage> fusedSearch(HybridSearchRequest request) {
        String sql = """
                SELECT chunk_id, document_id, content, similarity, metadata,
                       document_title, document_source, document_metadata, is_toc, score
                FROM hybrid_search(?, ?, ?, ?, ?, ?, ?)
                """;

        List<RetrievedPassage> rows = jdbcTemplate.query(sql, ps -> {
            ps.setString(1, request.queryText());
            ps.setObject(2, new PGvector(request.queryEmbedding()));
            ps.setInt(3, request.limit());
            ps.setDouble(4, request.similarityThreshold());
            ps.setInt(5, request.rrfK());
            ps.setBoolean(6, request.excludeBoilerplate());
            ps.setInt(7, request.maxPerDocument());
        }, new PassageRowMapper(true));
        return withoutUnscored(rows);
    }

    @Override
    public List<RetrievedPassage> vectorSearch(float[] queryEmbedding, int limit, double similarityThreshold) {
        String sql = """
                SELECT chunk_id, document_id, content, similarity, metadata,
                       document_title, document_source, document_metadata, is_toc
                FROM match_chunks(?, ?, ?)
                """;

        List<RetrievedPassage> rows = jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, new PGvector(queryEmbedding));
            ps.setInt(2, limit);
            ps.setDouble(3, similarityThreshold);
        }, new PassageRowMapper(false));
        return withoutUnscored(rows);
    }

    @Override
    public Optional<KbDocument> findDocumentById(String documentId) {
        String sql = """
                SELECT d.id::text AS id, d.title, d.source, d.metadata, d.created_at,
                       (SELECT count(*) FROM chunks c WHERE c.document_id = d.id) AS chunk_count
                FROM documents d
                WHERE d.id::text = ?
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            KbDocument doc = new KbDocument();
            doc.setId(rs.getString("id"));
            doc.setTitle(rs.getString("title"));
            doc.setSource(rs.getString("source"));
            doc.setMetadata(readJson(rs.getString("metadata")));
            doc.setChunkCount(rs.getInt("chunk_count"));
            Timestamp createdAt = rs.getTimestamp("created_at");
            doc.setCreatedAt(createdAt == null ? null : createdAt.toInstant());
            return doc;
        }, documentId).stream().findFirst();
    }

    private class PassageRowMapper implements RowMapper<RetrievedPassage> {

        private final boolean fused;

        PassageRowMapper(boolean fused) {
            this.fused = fused;
        }

        /**
         * Returns null for a row without a usable similarity, see {@link #withoutUnscored}.
         */
        @Override
        public RetrievedPassage mapRow(ResultSet rs, int rowNum) throws SQLException {
            double similarity = rs.getDouble("similarity");
            if (Double.isNaN(similarity)) {
                log.warn("Skipping chunk {} with NaN similarity (zero or missing embedding)", rs.getString("chunk_id"));
                return null;
            }
            return RetrievedPassage.builder()
                    .chunkId(rs.getString("chunk_id"))
                    .documentId(rs.getString("document_id"))
                    .documentTitle(rs.getString("document_title"))
                    .documentSource(rs.getString("document_source"))
                    .content(rs.getString("content"))
                    .similarity(similarity)
                    .fusionScore(fused ? rs.getDouble("score") : null)
                    .metadata(toMetadata(readJson(rs.getString("metadata")), readJson(rs.getString("document_metadata"))))
                    .boilerplate(rs.getBoolean("is_toc"))
                    .build();
        }
    }

    private static List<RetrievedPassage> withoutUnscored(List<RetrievedPassage> rows) {
        return rows.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Page numbers come from the chunk metadata, the crawl URL from the document metadata.
     */
    PassageMetadata toMetadata(JsonNode chunkMetadata, JsonNode documentMetadata) {
        Integer pageStart = intField(chunkMetadata, "page_start");
        Integer pageEnd = intField(chunkMetadata, "page_end");
        String url = documentMetadata != null && documentMetadata.hasNonNull("url")
                ? documentMetadata.get("url").asText()
                : null;

        Map<String, Object> extensions = new HashMap<>();
        if (chunkMetadata != null && chunkMetadata.isObject()) {
            extensions.putAll(objectMapper.convertValue(chunkMetadata, MAP_TYPE));
            extensions.remove("page_start");
            extensions.remove("page_end");
        }
        extensions.values().removeIf(v -> v == null);

        if (pageStart != null && pageEnd != null && pageEnd < pageStart) {
            log.debug("Ignoring inverted page range {}-{}", pageStart, pageEnd);
            pageEnd = pageStart;
        }
        return new PassageMetadata(pageStart, pageEnd, url, extensions);
    }

    private JsonNode readJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            // malformed metadata must not fail the search
            log.debug("Unreadable metadata column: {}", e.getMessage());
            return null;
        }
    }

    private static Integer intField(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field) || !node.get(field).canConvertToInt()) {
            return null;
        }
        return node.get(field).asInt();
    }
}
