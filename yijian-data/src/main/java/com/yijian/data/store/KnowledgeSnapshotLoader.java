package com.yijian.data.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yijian.common.constants.Subject;
import com.yijian.data.config.StoreProperties;
import com.yijian.data.model.KnowledgeChunk;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the offline ingestion export into the in-memory store at startup.
 *
 * Expected format: a JSON array of
 * {@code {"id", "subject", "content", "source_label", "page", "embedding": [..]}}.
 */
@Component
@ConditionalOnProperty(prefix = "yijian.store", name = "type", havingValue = "memory")
@RequiredArgsConstructor
@Slf4j
public class KnowledgeSnapshotLoader {
    
    private final StoreProperties storeProperties;
    private final InMemoryKnowledgeStore store;
    private final ObjectMapper objectMapper;
    
    @PostConstruct
    public void loadConfiguredSnapshot() {
        String path = storeProperties.getSnapshotPath();
        if (path == null || path.isBlank()) {
            log.warn("[SNAPSHOT] yijian.store.snapshot-path not set, memory store starts empty");
            return;
        }
        
        long startTime = System.currentTimeMillis();
        try (InputStream in = Files.newInputStream(Path.of(path))) {
            List<KnowledgeChunk> chunks = read(in);
            store.replaceAll(chunks);
            log.info("[SNAPSHOT] Corpus loaded | path={} | chunks={} | durationMs={}", 
                path, chunks.size(), System.currentTimeMillis() - startTime);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load knowledge snapshot from " + path, e);
        }
    }
    
    public List<KnowledgeChunk> read(InputStream in) throws IOException {
        List<SnapshotRecord> records = objectMapper.readValue(in, new TypeReference<List<SnapshotRecord>>() {});
        List<KnowledgeChunk> chunks = new ArrayList<>(records.size());
        for (SnapshotRecord record : records) {
            chunks.add(KnowledgeChunk.builder()
                .id(record.getId())
                .subject(Subject.fromString(record.getSubject()))
                .content(record.getContent())
                .sourceLabel(record.getSourceLabel())
                .pageNumber(record.getPage())
                .embedding(record.getEmbedding())
                .build());
        }
        return chunks;
    }
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SnapshotRecord {
        private String id;
        private String subject;
        private String content;
        @JsonProperty("source_label")
        private String sourceLabel;
        private Integer page;
        private float[] embedding;
    }
}
