package jobsched.jdbc;

import jobsched.jdbc.store.AbstractJdbcJobStore;
import jobsched.jdbc.store.PostgresJobStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresJobStoreIntegrationTest extends AbstractJobStoreIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("jobsched_test");

    private static DataSource dataSource;
    private static PostgresJobStore store;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new TestDatabases.DriverManagerDataSource(
                postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        TestDatabases.applySchema(dataSource, "postgresql");
        store = new PostgresJobStore(new DataSourceConnectionProvider(dataSource));
    }

    @BeforeEach
    void truncate() throws Exception {
        TestDatabases.truncate(dataSource);
    }

    @Override
    AbstractJdbcJobStore store() {
        return store;
    }
}
