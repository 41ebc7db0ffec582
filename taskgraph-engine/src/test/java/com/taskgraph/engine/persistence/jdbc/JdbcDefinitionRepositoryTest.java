package com.taskgraph.engine.persistence.jdbc;

import com.taskgraph.core.message.MessageCodec;
import com.taskgraph.core.repository.DefinitionRepository;
import com.taskgraph.engine.persistence.AbstractDefinitionRepositoryTest;
import org.junit.jupiter.api.BeforeAll;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the definition repository contract against PostgreSQL. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
public class JdbcDefinitionRepositoryTest extends AbstractDefinitionRepositoryTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static DriverManagerDataSource dataSource;

    @BeforeAll
    static void createSchema() {
        dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/taskgraph-schema.sql")).execute(dataSource);
    }

    @Override
    protected DefinitionRepository createRepository() {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM workflow_definitions");
        return new JdbcDefinitionRepository(jdbcTemplate, MessageCodec.defaultObjectMapper());
    }
}
