package jobsched.jdbc;

import jobsched.jdbc.store.AbstractJdbcJobStore;
import jobsched.jdbc.store.H2JobStore;
import jobsched.jdbc.store.MySqlJobStore;
import jobsched.jdbc.store.PostgresJobStore;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoresTest {
  private final ConnectionProvider unused = () -> {
    throw new SQLException("not connected");
  };

  @Test
  void detectsStoreFromJdbcUrl() {
    assertInstanceOf(MySqlJobStore.class,
        JdbcJobStores.detect("jdbc:mysql://localhost:3306/app", unused, "scheduled_job"));
    assertInstanceOf(MySqlJobStore.class,
        JdbcJobStores.detect("jdbc:tidb://localhost:4000/app", unused, "scheduled_job"));
    assertInstanceOf(PostgresJobStore.class,
        JdbcJobStores.detect("JDBC:POSTGRESQL://localhost/app", unused, "scheduled_job"));
    assertInstanceOf(H2JobStore.class,
        JdbcJobStores.detect("jdbc:h2:mem:test", unused, "scheduled_job"));
  }

  @Test
  void detectsStoreFromDataSource() throws Exception {
    AbstractJdbcJobStore store = JdbcJobStores.detect(TestDatabases.h2("detect"));

    assertEquals("h2", store.name());
  }

  @Test
  void unknownUrlIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> JdbcJobStores.detect("jdbc:oracle:thin:@localhost", unused, "scheduled_job"));
    assertTrue(ex.getMessage().contains("jdbc:postgresql:"));
    assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.detect("", unused, "scheduled_job"));
  }

  @Test
  void createsStoreByName() {
    assertEquals(List.of("h2", "mysql", "postgresql"), JdbcJobStores.names());
    assertEquals("postgresql", JdbcJobStores.create("PostgreSQL", unused, "scheduled_job").name());
    assertThrows(IllegalArgumentException.class, () -> JdbcJobStores.create("sqlite", unused, "scheduled_job"));
  }

  @Test
  void rejectsUnsafeTableName() {
    assertThrows(IllegalArgumentException.class, () -> new H2JobStore(unused, "jobs; DROP TABLE x"));
    assertEquals("billing_job", TableNames.validate("billing_job"));
  }

  @Test
  void connectionFailureSurfacesAsStoreException() {
    H2JobStore store = new H2JobStore(unused);

    JobStoreException ex = assertThrows(JobStoreException.class, () -> store.findByName("x"));
    assertFalse(ex.isUniqueViolation());
  }
}
