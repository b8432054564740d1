package com.yijian.data.store;

import com.yijian.common.constants.Subject;
import com.yijian.common.exception.EmbeddingUnavailableException;
import com.yijian.data.model.CorpusStats;
import com.yijian.data.model.KnowledgeChunk;
import com.yijian.data.model.ScoredChunk;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryKnowledgeStoreTest {

    private static KnowledgeChunk chunk(String id, Subject subject, float... embedding) {
        return KnowledgeChunk.builder()
            .id(id)
            .subject(subject)
            .content("content of " + id)
            .sourceLabel("label " + id)
            .embedding(embedding)
            .build();
    }

    @Test
    void returnsHitsBestFirstWithinTheLimit() {
        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore(List.of(
            chunk("a", Subject.ENGINEERING_ECONOMICS, 1f, 0f),
            chunk("b", Subject.ENGINEERING_ECONOMICS, 0.6f, 0.8f),
            chunk("c", Subject.PROJECT_MANAGEMENT, 0f, 1f)));

        List<ScoredChunk> hits = store.search(new float[]{1f, 0f}, null, 2);

        assertThat(hits).extracting(ScoredChunk::getId).containsExactly("a", "b");
        assertThat(hits.get(0).getScore()).isEqualTo(1.0, org.assertj.core.data.Offset.offset(1e-9));
        assertThat(hits.get(1).getScore()).isEqualTo(0.6, org.assertj.core.data.Offset.offset(1e-6));
    }

    @Test
    void subjectFilterRestrictsTheSearch() {
        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore(List.of(
            chunk("a", Subject.ENGINEERING_ECONOMICS, 1f, 0f),
            chunk("c", Subject.PROJECT_MANAGEMENT, 0f, 1f)));

        List<ScoredChunk> hits = store.search(new float[]{1f, 0f}, Subject.PROJECT_MANAGEMENT, 5);

        assertThat(hits).extracting(h -> h.getChunk().getSubject()).containsOnly(Subject.PROJECT_MANAGEMENT);
    }

    @Test
    void equalScoresAreOrderedByChunkId() {
        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore(List.of(
            chunk("z-2", Subject.LAW_AND_REGULATION, 1f, 0f),
            chunk("a-1", Subject.LAW_AND_REGULATION, 2f, 0f)));

        List<ScoredChunk> hits = store.search(new float[]{3f, 0f}, null, 5);

        assertThat(hits).extracting(ScoredChunk::getId).containsExactly("a-1", "z-2");
    }

    @Test
    void rejectsMixedDimensionsAndSkipsChunksWithoutEmbedding() {
        assertThatThrownBy(() -> new InMemoryKnowledgeStore(List.of(
            chunk("a", Subject.ENGINEERING_ECONOMICS, 1f, 0f),
            chunk("b", Subject.ENGINEERING_ECONOMICS, 1f, 0f, 0f))))
            .isInstanceOf(IllegalArgumentException.class);

        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore(List.of(
            chunk("a", Subject.ENGINEERING_ECONOMICS, 1f, 0f),
            KnowledgeChunk.builder().id("no-vector").subject(Subject.ENGINEERING_ECONOMICS).content("x").build()));

        CorpusStats stats = store.stats();
        assertThat(stats.getTotal()).isEqualTo(1);
        assertThat(stats.getBySubject()).containsEntry(Subject.ENGINEERING_ECONOMICS, 1L);
    }

    @Test
    void rejectsChunksWithoutId() {
        assertThatThrownBy(() -> new InMemoryKnowledgeStore(List.of(
            chunk("a", Subject.ENGINEERING_ECONOMICS, 1f, 0f),
            chunk(null, Subject.ENGINEERING_ECONOMICS, 0f, 1f))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("without id");

        assertThatThrownBy(() -> new InMemoryKnowledgeStore(List.of(
            chunk("  ", Subject.ENGINEERING_ECONOMICS, 0f, 1f))))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void queryWithWrongDimensionIsAnEmbeddingFailure() {
        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore(List.of(
            chunk("a", Subject.ENGINEERING_ECONOMICS, 1f, 0f, 0f)));

        assertThatThrownBy(() -> store.search(new float[]{1f, 0f, 0f, 0f}, null, 5))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessageContaining("4 dimensions");
    }

    @Test
    void emptyStoreAcceptsAnyDimension() {
        assertThat(new InMemoryKnowledgeStore().search(new float[]{1f, 0f, 0f, 0f}, null, 5)).isEmpty();
    }

    @Test
    void readersKeepWorkingWhileTheSnapshotIsSwapped() throws Exception {
        InMemoryKnowledgeStore store = new InMemoryKnowledgeStore(List.of(
            chunk("old", Subject.ENGINEERING_ECONOMICS, 1f, 0f)));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<List<ScoredChunk>>> reads = new java.util.ArrayList<>();
            for (int i = 0; i < 50; i++) {
                reads.add(pool.submit(() -> {
                    start.await();
                    return store.search(new float[]{1f, 0f}, null, 5);
                }));
            }
            start.countDown();
            store.replaceAll(List.of(chunk("new", Subject.ENGINEERING_ECONOMICS, 1f, 0f)));

            for (Future<List<ScoredChunk>> read : reads) {
                assertThat(read.get(5, TimeUnit.SECONDS))
                    .singleElement()
                    .extracting(ScoredChunk::getId)
                    .isIn("old", "new");
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(store.search(new float[]{1f, 0f}, null, 5))
            .extracting(ScoredChunk::getId).containsExactly("new");
    }
}
