package com.yijian.data.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * JPA is only wired when the pgvector store is active, so the memory profile runs without a database.
 */
@Configuration
@ConditionalOnProperty(prefix = "yijian.store", name = "type", havingValue = "pgvector", matchIfMissing = true)
@EntityScan("com.yijian.data.entity")
@EnableJpaRepositories("com.yijian.data.repository")
public class JpaConfig {
}
