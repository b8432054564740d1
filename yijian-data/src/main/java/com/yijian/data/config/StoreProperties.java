package com.yijian.data.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "yijian.store")
@Getter
@Setter
public class StoreProperties {
    private String type = "pgvector"; // "pgvector" or "memory"
    private String snapshotPath; // JSON export of the ingested corpus, used by the memory store
    private int embeddingDimension = 1536; // must match textbook_chunks.embedding; 0 disables the check
}
