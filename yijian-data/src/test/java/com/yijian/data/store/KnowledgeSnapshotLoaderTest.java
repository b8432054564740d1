package com.yijian.data.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yijian.common.constants.Subject;
import com.yijian.data.config.StoreProperties;
import com.yijian.data.model.KnowledgeChunk;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeSnapshotLoaderTest {

    private final InMemoryKnowledgeStore store = new InMemoryKnowledgeStore();

    @Test
    void readsExportWithAnySubjectSpelling() throws Exception {
        KnowledgeSnapshotLoader loader = new KnowledgeSnapshotLoader(new StoreProperties(), store, new ObjectMapper());

        List<KnowledgeChunk> chunks;
        try (InputStream in = getClass().getResourceAsStream("/snapshot/sample-corpus.json")) {
            chunks = loader.read(in);
        }

        assertThat(chunks).extracting(KnowledgeChunk::getSubject).containsExactly(
            Subject.ENGINEERING_ECONOMICS, Subject.PROJECT_MANAGEMENT, Subject.LAW_AND_REGULATION);
        assertThat(chunks.get(0).getSourceLabel()).isEqualTo("工程经济 第1章 第3页");
        assertThat(chunks.get(0).getPageNumber()).isEqualTo(3);
        assertThat(chunks.get(2).hasEmbedding()).isFalse();
    }

    @Test
    void configuredSnapshotIsPublishedToTheStore() throws Exception {
        StoreProperties properties = new StoreProperties();
        properties.setType("memory");
        properties.setSnapshotPath(Path.of(getClass().getResource("/snapshot/sample-corpus.json").toURI()).toString());

        new KnowledgeSnapshotLoader(properties, store, new ObjectMapper()).loadConfiguredSnapshot();

        // the chunk without an embedding is not searchable
        assertThat(store.stats().getTotal()).isEqualTo(2);
        assertThat(store.search(new float[]{0f, 1f, 0f}, null, 1))
            .singleElement()
            .satisfies(hit -> assertThat(hit.getId()).isEqualTo("xmgl-001"));
    }
}
