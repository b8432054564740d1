package com.yijian.data.store;

import com.yijian.common.constants.Subject;
import com.yijian.common.exception.EmbeddingUnavailableException;
import com.yijian.data.config.StoreProperties;
import com.yijian.data.model.CorpusStats;
import com.yijian.data.repository.TextbookChunkRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PgVectorKnowledgeStoreTest {

    @Mock
    private TextbookChunkRepository repository;

    private PgVectorKnowledgeStore store;

    @BeforeEach
    void setUp() {
        StoreProperties properties = new StoreProperties();
        properties.setEmbeddingDimension(2);
        store = new PgVectorKnowledgeStore(repository, properties);
    }

    @Test
    void passesQueryVectorInPgvectorTextForm() {
        when(repository.findNearest("[0.5,1.0]", Subject.PROJECT_MANAGEMENT, 15)).thenReturn(List.of());

        assertThat(store.search(new float[]{0.5f, 1f}, Subject.PROJECT_MANAGEMENT, 15)).isEmpty();

        verify(repository).findNearest("[0.5,1.0]", Subject.PROJECT_MANAGEMENT, 15);
    }

    @Test
    void sumsGroupedCounts() {
        when(repository.countGroupedBySubject()).thenReturn(List.of(
            new Object[]{Subject.ENGINEERING_ECONOMICS, 120L},
            new Object[]{Subject.LAW_AND_REGULATION, 80L}));

        CorpusStats stats = store.stats();

        assertThat(stats.getTotal()).isEqualTo(200);
        assertThat(stats.getBySubject())
            .containsEntry(Subject.ENGINEERING_ECONOMICS, 120L)
            .containsEntry(Subject.LAW_AND_REGULATION, 80L)
            .doesNotContainKey(Subject.PROJECT_MANAGEMENT);
    }

    @Test
    void queryWithWrongDimensionNeverReachesTheDatabase() {
        assertThatThrownBy(() -> store.search(new float[]{1f, 0f, 0f}, null, 5))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessageContaining("3 dimensions");

        verifyNoInteractions(repository);
    }
}
