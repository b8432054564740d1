package com.yijian.core.query;

import com.yijian.common.util.TextUtils;
import com.yijian.core.config.EngineProperties;
import com.yijian.core.query.model.RetrievedChunk;
import com.yijian.core.query.model.Source;
import com.yijian.data.model.KnowledgeChunk;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the chunks placed into a prompt into the response's source list. Never looks at the
 * generated text.
 */
@Service
@RequiredArgsConstructor
public class CitationResolver {

    private final EngineProperties properties;

    public List<Source> resolve(List<RetrievedChunk> placedChunks) {
        List<RetrievedChunk> ordered = new ArrayList<>(placedChunks);
        ordered.sort(Comparator.comparingInt(RetrievedChunk::getRank));

        Set<String> seen = new HashSet<>();
        List<Source> sources = new ArrayList<>(ordered.size());
        for (RetrievedChunk retrieved : ordered) {
            KnowledgeChunk chunk = retrieved.getChunk();
            if (!seen.add(chunk.getId())) {
                continue;
            }
            sources.add(Source.builder()
                .chunkId(chunk.getId())
                .subject(chunk.getSubject())
                .sourceLabel(chunk.getSourceLabel())
                .pageNumber(chunk.getPageNumber())
                .content(TextUtils.truncateCodePoints(
                    chunk.getContent() == null ? "" : chunk.getContent(), properties.getExcerptMaxChars()))
                .score(retrieved.getScore())
                .build());
        }
        return List.copyOf(sources);
    }
}
