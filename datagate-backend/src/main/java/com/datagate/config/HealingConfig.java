package com.datagate.config;

import com.datagate.healing.QueryWithHealingTool;
import com.datagate.healing.SelfHealingQueryExecutor;
import com.datagate.healing.SemanticColumnMatcher;
import com.datagate.ontology.ColumnOntology;
import com.datagate.ontology.InMemoryLearnedMappingStore;
import com.datagate.ontology.JsonFileLearnedMappingStore;
import com.datagate.ontology.LearnedMappingStore;
import com.datagate.oracle.ColumnOracle;
import com.datagate.oracle.PortkeyColumnOracle;
import com.datagate.sql.JdbcSqlBackend;
import com.datagate.sql.SqlBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires the self-healing query path: query pool, ontology, learned mappings, oracle and executor.
 */
@Slf4j
@Configuration
public class HealingConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource queryDataSource(
            @Value("${datagate.sql.jdbc-url}") String jdbcUrl,
            @Value("${datagate.sql.username:}") String username,
            @Value("${datagate.sql.password:}") String password,
            @Value("${datagate.sql.maximum-pool-size:5}") int maximumPoolSize
    ) {
        return new HikariDataSource(JdbcSqlBackend.buildHikariConfig(jdbcUrl, username, password, maximumPoolSize));
    }

    @Bean
    public SqlBackend sqlBackend(
            HikariDataSource queryDataSource,
            @Value("${datagate.sql.query-timeout-ms:30000}") int queryTimeoutMs,
            @Value("${datagate.sql.max-rows:1000}") int maxRows
    ) {
        return new JdbcSqlBackend(queryDataSource, queryTimeoutMs, maxRows);
    }

    @Bean
    public ColumnOntology columnOntology(
            ObjectMapper objectMapper,
            @Value("${datagate.healing.ontology-resource:column_ontology.json}") String resource
    ) {
        return ColumnOntology.fromClasspath(resource, objectMapper);
    }

    @Bean
    public LearnedMappingStore learnedMappingStore(
            ObjectMapper objectMapper,
            @Value("${datagate.healing.learned-mappings-file:}") String file
    ) {
        if (file == null || file.isBlank()) {
            log.info("Learned column mappings kept in memory (datagate.healing.learned-mappings-file not set)");
            return new InMemoryLearnedMappingStore();
        }
        return new JsonFileLearnedMappingStore(Path.of(file.trim()), objectMapper);
    }

    @Bean
    public SemanticColumnMatcher semanticColumnMatcher(ColumnOntology columnOntology, LearnedMappingStore learnedMappingStore) {
        return new SemanticColumnMatcher(columnOntology, learnedMappingStore);
    }

    @Bean
    public ColumnOracle columnOracle(ObjectMapper objectMapper, Environment environment) {
        PortkeyColumnOracle oracle = new PortkeyColumnOracle(objectMapper, environment);
        oracle.logConfigStatus();
        return oracle;
    }

    @Bean
    public SelfHealingQueryExecutor selfHealingQueryExecutor(
            SqlBackend sqlBackend,
            SemanticColumnMatcher semanticColumnMatcher,
            LearnedMappingStore learnedMappingStore,
            ColumnOracle columnOracle,
            @Value("${datagate.healing.max-retries:2}") int maxRetries,
            @Value("${datagate.healing.oracle-timeout-ms:10000}") long oracleTimeoutMs
    ) {
        return new SelfHealingQueryExecutor(
                sqlBackend,
                semanticColumnMatcher,
                learnedMappingStore,
                columnOracle,
                maxRetries,
                Duration.ofMillis(oracleTimeoutMs)
        );
    }

    @Bean
    public QueryWithHealingTool queryWithHealingTool(
            SelfHealingQueryExecutor selfHealingQueryExecutor,
            Validator validator,
            ObjectMapper objectMapper
    ) {
        return new QueryWithHealingTool(selfHealingQueryExecutor, validator, objectMapper);
    }
}
