package com.boxline.worker;

import com.boxline.worker.jobs.FailedEventRetryJob;
import com.boxline.worker.jobs.GracePeriodSweepJob;
import com.boxline.worker.jobs.MonthlyOverageJob;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class WorkerContextLoadsTest {

  @Autowired
  ApplicationContext context;

  @Test
  void schedulesAllBillingJobs() {
    assertThat(context.getBean(MonthlyOverageJob.class)).isNotNull();
    assertThat(context.getBean(FailedEventRetryJob.class)).isNotNull();
    assertThat(context.getBean(GracePeriodSweepJob.class)).isNotNull();
  }
}
