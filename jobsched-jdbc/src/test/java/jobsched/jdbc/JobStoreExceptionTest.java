package jobsched.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobStoreExceptionTest {

  @Test
  void detectsStandardUniqueViolationState() {
    JobStoreException e = new JobStoreException("insert",
        new SQLException("dup", "23505"));
    assertTrue(e.isUniqueViolation());
  }

  @Test
  void detectsMySqlDuplicateEntryCode() {
    JobStoreException e = new JobStoreException("insert",
        new SQLException("Duplicate entry", "23000", 1062));
    assertTrue(e.isUniqueViolation());
  }

  @Test
  void walksCauseChain() {
    SQLException wrapped = new SQLException("outer", "HY000");
    wrapped.initCause(new SQLException("dup", "23505"));
    assertTrue(new JobStoreException("insert", wrapped).isUniqueViolation());
  }

  @Test
  void otherIntegrityErrorsAreNotDuplicates() {
    JobStoreException notNull = new JobStoreException("insert",
        new SQLException("null", "23502"));
    assertFalse(notNull.isUniqueViolation());
    assertFalse(new JobStoreException("io", new RuntimeException("boom")).isUniqueViolation());
  }
}
