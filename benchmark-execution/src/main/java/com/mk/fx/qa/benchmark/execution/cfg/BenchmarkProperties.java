package com.mk.fx.qa.benchmark.execution.cfg;

import com.mk.fx.qa.benchmark.execution.config.BenchmarkConfigValidator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "benchmark")
public class BenchmarkProperties {

  /** Runs executed at the same time. Keep at 1 so runs do not skew each other. */
  @Min(1)
  @Max(8)
  private int concurrency = 1;

  /** Runs that may wait for a free slot; further submissions are rejected. */
  @Positive private int queueCapacity = 20;

  @Positive private int historySize = 50;

  @Positive
  @Max(BenchmarkConfigValidator.MAX_CONCURRENT_USERS)
  private int defaultUsers = 100;

  @Positive private int defaultDurationSeconds = 60;

  @PositiveOrZero private int defaultRampUpSeconds = 10;

  @Positive private int connectTimeoutSeconds = 5;

  @Positive private int requestTimeoutSeconds = 30;

  @NotNull private Duration interRequestPause = Duration.ofMillis(10);

  @NotNull private Duration scenarioPause = Duration.ofSeconds(5);

  @NotNull private Duration targetPause = Duration.ofSeconds(30);

  @NotBlank private String reportDirectory = "reports";

  /** Headers added to every request sent to a target. */
  private Map<String, String> defaultHeaders = new LinkedHashMap<>();
}
