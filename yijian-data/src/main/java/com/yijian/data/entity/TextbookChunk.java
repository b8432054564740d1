package com.yijian.data.entity;

import com.yijian.common.constants.Subject;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Row of the pgvector-backed textbook corpus. Rows are written by the offline ingestion job.
 * The {@code embedding vector(1536)} column is only read through native queries.
 */
@Entity
@Table(name = "textbook_chunks")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TextbookChunk {
    
    @Id
    @Column(name = "id", length = 64)
    private String id;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "subject", nullable = false, length = 64)
    private Subject subject;
    
    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;
    
    @Column(name = "source_label", nullable = false)
    private String sourceLabel;
    
    @Column(name = "page_number")
    private Integer pageNumber;
    
    @CreationTimestamp
    @Column(name = "created_at")
    private Instant createdAt;
}
