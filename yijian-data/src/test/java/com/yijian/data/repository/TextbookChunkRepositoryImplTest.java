package com.yijian.data.repository;

import com.yijian.common.constants.Subject;
import com.yijian.data.model.ScoredChunk;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class TextbookChunkRepositoryImplTest {

    @Test
    void mapsNativeRowIncludingVectorText() {
        Object[] row = {"jdsw-042", "ELECTROMECHANICAL_PRACTICE", "起重机械的选用...", "机电实务 第2章 第45页",
            45, "[0.5,0.25]", new BigDecimal("0.87")};

        ScoredChunk hit = TextbookChunkRepositoryImpl.mapRow(row);

        assertThat(hit.getId()).isEqualTo("jdsw-042");
        assertThat(hit.getChunk().getSubject()).isEqualTo(Subject.ELECTROMECHANICAL_PRACTICE);
        assertThat(hit.getChunk().getPageNumber()).isEqualTo(45);
        assertThat(hit.getChunk().getEmbedding()).containsExactly(0.5f, 0.25f);
        assertThat(hit.getScore()).isEqualTo(0.87);
    }

    @Test
    void nullablesStayNull() {
        Object[] row = {"fgfl-7", "LAW_AND_REGULATION", "text", "label", null, null, 0.4d};

        ScoredChunk hit = TextbookChunkRepositoryImpl.mapRow(row);

        assertThat(hit.getChunk().getPageNumber()).isNull();
        assertThat(hit.getChunk().hasEmbedding()).isFalse();
    }
}
