package com.optwise.docai.app.config;

import com.optwise.docai.app.scheduler.UploadSweepScheduler;
import com.optwise.docai.app.service.DocumentProcessingPipeline;
import com.optwise.docai.app.service.StatusService;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import software.amazon.awssdk.services.s3.S3Client;

@Log4j2
@Configuration
@EnableScheduling
public class SchedulerConfig {

  @Value("${scheduled.threadpool.size:2}")
  private int poolSize;

  @Value("${scheduled.threadpool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /** Scheduler pool for @Scheduled jobs; waits for a running sweep on shutdown. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("upload-sweep-");
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in scheduled task", t));
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);
    scheduler.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    scheduler.initialize();
    log.info(
        "ThreadPoolTaskScheduler initialized poolSize={} awaitTerminationSeconds={}",
        poolSize,
        awaitTerminationSeconds);
    return scheduler;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "scheduled.sweep",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = false)
  public UploadSweepScheduler uploadSweepScheduler(
      S3Client s3,
      DocumentProcessingPipeline pipeline,
      StatusService status,
      DocAiProperties props,
      @Value("${scheduled.sweep.max-per-run:25}") int maxPerRun,
      @Value("${scheduled.sweep.dry-run:false}") boolean dryRun) {
    return new UploadSweepScheduler(
        s3,
        pipeline,
        status,
        props.getS3().getBucket(),
        props.getS3().getUploadPrefix(),
        maxPerRun,
        dryRun);
  }
}
