package com.mk.fx.qa.benchmark.execution.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.benchmark.execution.executors.HttpRequestExecutor;
import com.mk.fx.qa.benchmark.execution.executors.LoadTester;
import com.mk.fx.qa.benchmark.execution.executors.RequestExecutor;
import com.mk.fx.qa.benchmark.execution.report.ComparisonReporter;
import com.mk.fx.qa.benchmark.execution.report.HtmlReportRenderer;
import com.mk.fx.qa.benchmark.execution.report.JsonReportRenderer;
import com.mk.fx.qa.benchmark.execution.report.MarkdownReportRenderer;
import com.mk.fx.qa.benchmark.execution.selector.WeightedEndpointSelector;
import com.mk.fx.qa.benchmark.execution.service.BenchmarkSuiteRunner;
import com.mk.fx.qa.benchmark.rest.LoadHttpClient;
import java.time.Clock;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the benchmark engine. One HTTP client is shared by every run and every virtual user. */
@Configuration
public class BenchmarkEngineCfg {

  @Bean(destroyMethod = "close")
  public LoadHttpClient loadHttpClient(BenchmarkProperties properties) {
    return new LoadHttpClient(
        properties.getConnectTimeoutSeconds(),
        properties.getRequestTimeoutSeconds(),
        properties.getDefaultHeaders());
  }

  @Bean
  public RequestExecutor requestExecutor(LoadHttpClient loadHttpClient) {
    return new HttpRequestExecutor(loadHttpClient);
  }

  @Bean
  public WeightedEndpointSelector weightedEndpointSelector() {
    return new WeightedEndpointSelector();
  }

  @Bean
  public LoadTester loadTester(
      RequestExecutor requestExecutor,
      WeightedEndpointSelector selector,
      BenchmarkProperties properties) {
    return new LoadTester(requestExecutor, selector, properties.getInterRequestPause());
  }

  @Bean
  public BenchmarkSuiteRunner benchmarkSuiteRunner(
      LoadTester loadTester, BenchmarkProperties properties) {
    return new BenchmarkSuiteRunner(
        loadTester, properties.getScenarioPause(), properties.getTargetPause());
  }

  @Bean
  public Clock benchmarkClock() {
    return Clock.systemUTC();
  }

  @Bean
  public ComparisonReporter comparisonReporter(Clock benchmarkClock, ObjectMapper objectMapper) {
    return new ComparisonReporter(
        benchmarkClock,
        List.of(
            new MarkdownReportRenderer(),
            new HtmlReportRenderer(),
            new JsonReportRenderer(objectMapper)));
  }
}
