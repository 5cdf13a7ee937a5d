package org.jstats.matchsync_api.modules.store.repository;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({SchemaInspector.class, TeamRepository.class})
class SchemaIntegrationTests {

    @Autowired
    DataSource dataSource;

    @Autowired
    NamedParameterJdbcTemplate jdbc;

    @Autowired
    SchemaInspector inspector;

    @Autowired
    TeamRepository teams;

    @Test
    void migrationCreatesAllTables() {
        assertEquals(Map.of("team", true, "team_stats", true, "fixture", true), inspector.tablesPresent());
    }

    @Test
    void reapplyingSchemaScript_isNoOp_andKeepsData() {
        jdbc.update("DELETE FROM fixture", new MapSqlParameterSource());
        jdbc.update("DELETE FROM team_stats", new MapSqlParameterSource());
        jdbc.update("DELETE FROM team", new MapSqlParameterSource());
        teams.ensureTeam("Crystal Palace", OffsetDateTime.now(ZoneOffset.UTC));

        var populator = new ResourceDatabasePopulator(new ClassPathResource("db/migration/V1__sync_schema.sql"));
        assertDoesNotThrow(() -> populator.execute(dataSource));

        assertEquals(1, teams.count());
        assertTrue(inspector.tablesPresent().values().stream().allMatch(Boolean::booleanValue));
    }
}
