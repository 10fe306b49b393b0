package app.danki.core.support;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Base for tests that need a real PostgreSQL. One container is started lazily
 * and shared by every subclass for the whole run; without Docker the tests
 * are skipped.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class PostgresIntegrationTest {

    private static final DockerImageName IMAGE = DockerImageName.parse("postgres:16-alpine");

    private static PostgreSQLContainer<?> postgres;

    @DynamicPropertySource
    static void configureDataSource(DynamicPropertyRegistry registry) {
        PostgreSQLContainer<?> container = container();

        registry.add("spring.datasource.url", container::getJdbcUrl);
        registry.add("spring.datasource.username", container::getUsername);
        registry.add("spring.datasource.password", container::getPassword);
        registry.add("spring.flyway.url", container::getJdbcUrl);
        registry.add("spring.flyway.user", container::getUsername);
        registry.add("spring.flyway.password", container::getPassword);
    }

    private static synchronized PostgreSQLContainer<?> container() {
        if (postgres == null) {
            postgres = new PostgreSQLContainer<>(IMAGE)
                    .withDatabaseName("danki")
                    .withUsername("danki")
                    .withPassword("danki");
            postgres.start();
        }
        return postgres;
    }
}
