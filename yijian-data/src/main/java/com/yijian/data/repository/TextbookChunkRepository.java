package com.yijian.data.repository;

import com.yijian.data.entity.TextbookChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface TextbookChunkRepository extends JpaRepository<TextbookChunk, String>, TextbookChunkRepositoryCustom {
    
    /**
     * Rows of [Subject, Long].
     */
    @Query("SELECT c.subject, COUNT(c) FROM TextbookChunk c GROUP BY c.subject")
    List<Object[]> countGroupedBySubject();
}
