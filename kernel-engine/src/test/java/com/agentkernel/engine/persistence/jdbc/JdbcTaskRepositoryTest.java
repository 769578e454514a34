package com.agentkernel.engine.persistence.jdbc;

import com.agentkernel.core.exception.DuplicateTaskException;
import com.agentkernel.core.model.CheckResult;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.model.TaskFilter;
import com.agentkernel.core.model.TaskPriority;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Conditional-update semantics against a real PostgreSQL.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcTaskRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("kernel_test")
        .withUsername("test")
        .withPassword("test");

    private static JdbcTemplate jdbcTemplate;

    private JdbcTaskRepository repository;
    private final Instant now = Instant.parse("2025-03-01T10:00:00Z");

    @BeforeAll
    static void createSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM tasks");
        repository = new JdbcTaskRepository(jdbcTemplate, new ObjectMapper());
    }

    @Test
    @DisplayName("Stored tasks read back with checks and check results intact")
    void testSaveAndFind() {
        Task task = Task.create("T-1", "persist me", "implement", now).toBuilder()
            .priority(TaskPriority.P1)
            .checks(List.of("lint", "review"))
            .checkResults(Map.of("lint", CheckResult.pass("clean", now)))
            .branch("release/2.0")
            .build();
        repository.save(task);

        Task loaded = repository.findById("T-1").orElseThrow();

        assertThat(loaded.priority()).isEqualTo(TaskPriority.P1);
        assertThat(loaded.checks()).containsExactly("lint", "review");
        assertThat(loaded.hasPassed("lint")).isTrue();
        assertThat(loaded.hasPassed("review")).isFalse();
        assertThat(loaded.branch()).isEqualTo("release/2.0");
        assertThat(loaded.createdAt()).isEqualTo(now);
        assertThatThrownBy(() -> repository.save(task)).isInstanceOf(DuplicateTaskException.class);
    }

    @Test
    @DisplayName("Only the first update against a given version succeeds")
    void testCompareAndSet() {
        Task task = Task.create("T-1", "race", "implement", now);
        repository.save(task);

        Task first = task.withClaim("a", "orch-1", "claimed", now, Duration.ofMinutes(5));
        Task second = task.withClaim("b", "orch-2", "claimed", now, Duration.ofMinutes(5));

        Optional<Task> won = repository.compareAndSet(first, "incoming", 0);
        Optional<Task> lost = repository.compareAndSet(second, "incoming", 0);

        assertThat(won).isPresent();
        assertThat(won.get().version()).isEqualTo(1);
        assertThat(lost).isEmpty();
        assertThat(repository.findById("T-1").orElseThrow().claimedBy()).isEqualTo("a");
    }

    @Test
    @DisplayName("Claim candidates are unclaimed and ordered by priority, creation time and id")
    void testClaimCandidates() {
        repository.save(Task.create("T-b", "b", "implement", now));
        repository.save(Task.create("T-a", "a", "implement", now));
        repository.save(Task.create("T-p0", "urgent", "implement", now.plusSeconds(60)).toBuilder()
            .priority(TaskPriority.P0).build());
        repository.save(Task.create("T-other", "x", "writer", now));

        List<Task> candidates = repository.findClaimCandidates("incoming", "implement", null, 10);

        assertThat(candidates).extracting(Task::id).containsExactly("T-p0", "T-a", "T-b");
    }

    @Test
    @DisplayName("Expired claims include review claims")
    void testFindExpiredClaims() {
        Task work = Task.create("T-1", "w", "implement", now);
        Task review = Task.create("T-2", "r", "implement", now).withQueue("provisional", now);
        repository.save(work);
        repository.save(review);
        repository.compareAndSet(work.withClaim("a", "orch", "claimed", now, Duration.ofMinutes(5)), "incoming", 0);
        repository.compareAndSet(review.withClaim("g", "orch", "provisional", now, Duration.ofMinutes(5)),
            "provisional", 0);

        assertThat(repository.findExpiredClaims(now.plusSeconds(60), 10)).isEmpty();
        assertThat(repository.findExpiredClaims(now.plus(Duration.ofMinutes(6)), 10))
            .extracting(Task::id).containsExactlyInAnyOrder("T-1", "T-2");
        assertThat(repository.find(TaskFilter.ownedBy("orch"))).hasSize(2);
        assertThat(repository.countByQueue("claimed")).isEqualTo(1);
    }
}
