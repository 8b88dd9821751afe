package jobsched.spring.boot;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobSchedulerPropertiesTest {

  @Test
  void defaults() {
    JobSchedulerProperties props = new JobSchedulerProperties();

    assertEquals("jobs", props.getDefaultChannelName());
    assertEquals(10, props.getReloadIntervalSeconds());
    assertTrue(props.getEmittingChannels().isEmpty());
    assertEquals("scheduled_job", props.getTableName());
    assertTrue(props.isAutoStart());
    assertEquals("UTC", props.getZone());
    assertEquals(500, props.getTick().getMinDelayMs());
    assertEquals(900, props.getTick().getMaxDelayMs());
    assertEquals(100, props.getTick().getFixedDelayMs());
    assertTrue(props.getMetrics().isEnabled());
    assertEquals("jobsched", props.getMetrics().getNamePrefix());
  }
}
