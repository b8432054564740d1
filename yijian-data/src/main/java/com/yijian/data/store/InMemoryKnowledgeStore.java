package com.yijian.data.store;

import com.yijian.common.constants.Subject;
import com.yijian.common.exception.EmbeddingUnavailableException;
import com.yijian.data.model.CorpusStats;
import com.yijian.data.model.KnowledgeChunk;
import com.yijian.data.model.ScoredChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Brute-force cosine search over an immutable snapshot.
 * Readers never lock; {@link #replaceAll(List)} publishes a new snapshot in one atomic swap.
 */
@Component
@ConditionalOnProperty(prefix = "yijian.store", name = "type", havingValue = "memory")
@Slf4j
public class InMemoryKnowledgeStore implements VectorKnowledgeStore {
    
    static final Comparator<ScoredChunk> BEST_FIRST = Comparator
        .comparingDouble(ScoredChunk::getScore).reversed()
        .thenComparing(ScoredChunk::getId);
    
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(new Snapshot(List.of(), -1));
    
    public InMemoryKnowledgeStore() {
    }
    
    public InMemoryKnowledgeStore(List<KnowledgeChunk> chunks) {
        replaceAll(chunks);
    }
    
    /**
     * Swap in a new corpus. Chunks without an embedding are skipped; every chunk needs a non-blank,
     * unique id and all embeddings must share one dimension.
     */
    public void replaceAll(List<KnowledgeChunk> chunks) {
        List<KnowledgeChunk> accepted = new ArrayList<>(chunks.size());
        Set<String> ids = new HashSet<>();
        int dimension = -1;
        int skipped = 0;
        
        for (KnowledgeChunk chunk : chunks) {
            if (!chunk.hasEmbedding() || chunk.getSubject() == null) {
                skipped++;
                continue;
            }
            if (chunk.getId() == null || chunk.getId().isBlank()) {
                throw new IllegalArgumentException("Chunk without id: " + chunk.getSourceLabel());
            }
            if (!ids.add(chunk.getId())) {
                throw new IllegalArgumentException("Duplicate chunk id: " + chunk.getId());
            }
            if (dimension == -1) {
                dimension = chunk.getEmbedding().length;
            } else if (chunk.getEmbedding().length != dimension) {
                throw new IllegalArgumentException(String.format(
                    "Chunk %s has %d dimensions, expected %d",
                    chunk.getId(), chunk.getEmbedding().length, dimension));
            }
            accepted.add(chunk);
        }
        
        snapshot.set(new Snapshot(List.copyOf(accepted), dimension));
        log.info("[MEMORY_STORE] Snapshot replaced | chunks={} | skipped={} | dimension={}", 
            accepted.size(), skipped, dimension);
    }
    
    @Override
    public List<ScoredChunk> search(float[] queryVector, Subject subject, int limit) {
        Snapshot current = snapshot.get();
        if (current.dimension > 0 && queryVector.length != current.dimension) {
            log.error("[MEMORY_STORE] Query embedding does not match corpus | queryDimension={} | corpusDimension={}",
                queryVector.length, current.dimension);
            throw new EmbeddingUnavailableException(String.format(
                "Query embedding has %d dimensions, corpus has %d", queryVector.length, current.dimension));
        }
        List<ScoredChunk> hits = new ArrayList<>();
        
        for (KnowledgeChunk chunk : current.chunks) {
            if (subject != null && chunk.getSubject() != subject) {
                continue;
            }
            hits.add(new ScoredChunk(chunk, VectorMath.cosine(queryVector, chunk.getEmbedding())));
        }
        
        hits.sort(BEST_FIRST);
        return hits.size() > limit ? List.copyOf(hits.subList(0, limit)) : List.copyOf(hits);
    }
    
    @Override
    public CorpusStats stats() {
        List<KnowledgeChunk> current = snapshot.get().chunks;
        Map<Subject, Long> bySubject = new EnumMap<>(Subject.class);
        for (KnowledgeChunk chunk : current) {
            bySubject.merge(chunk.getSubject(), 1L, Long::sum);
        }
        return CorpusStats.builder()
            .total(current.size())
            .bySubject(bySubject)
            .build();
    }
    
    @Override
    public String type() {
        return "memory";
    }

    private static final class Snapshot {
        private final List<KnowledgeChunk> chunks;
        private final int dimension;

        private Snapshot(List<KnowledgeChunk> chunks, int dimension) {
            this.chunks = chunks;
            this.dimension = dimension;
        }
    }
}
