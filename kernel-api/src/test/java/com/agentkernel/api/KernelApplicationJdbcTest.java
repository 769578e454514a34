package com.agentkernel.api;

import com.agentkernel.core.model.ClaimIntent;
import com.agentkernel.core.model.Task;
import com.agentkernel.core.repository.TaskRepository;
import com.agentkernel.engine.persistence.jdbc.JdbcTaskRepository;
import com.agentkernel.engine.service.ClaimService;
import com.agentkernel.engine.service.TaskService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full application context on PostgreSQL, schema created at startup.
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class KernelApplicationJdbcTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("kernel_test")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private TaskRepository taskRepository;

    @Autowired
    private TaskService taskService;

    @Autowired
    private ClaimService claimService;

    @Test
    @DisplayName("The JDBC store backs the kernel by default")
    void testJdbcStoreIsWired() {
        assertThat(taskRepository).isInstanceOf(JdbcTaskRepository.class);
    }

    @Test
    @DisplayName("Tasks created through the service can be claimed from the database")
    void testCreateAndClaim() {
        Task created = taskService.create(Task.create("DB-1", "persisted", "implement", null));

        Optional<Task> claimed = claimService.claim(
            ClaimIntent.forWork("implementer", "test-kernel", "implement", Duration.ofMinutes(5)));

        assertThat(created.version()).isZero();
        assertThat(claimed).get().satisfies(task -> {
            assertThat(task.id()).isEqualTo("DB-1");
            assertThat(task.queue()).isEqualTo("claimed");
            assertThat(task.claimedBy()).isEqualTo("implementer");
            assertThat(task.orchestratorId()).isEqualTo("test-kernel");
        });
    }
}
