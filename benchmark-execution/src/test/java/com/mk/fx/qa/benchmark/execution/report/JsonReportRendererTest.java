package com.mk.fx.qa.benchmark.execution.report;

import static com.mk.fx.qa.benchmark.execution.report.ComparisonReporterTest.result;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.benchmark.execution.cfg.ObjectMapperConfig;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonReportRendererTest {

  @Test
  void render_producesSnakeCaseDocumentWithWinners() throws Exception {
    var mapper = ObjectMapperConfig.create();
    var report =
        ComparisonReporterTest.reporter()
            .compare(
                "AXUM",
                List.of(result("AXUM", "GraphQL", 300, 3, 4, 5)),
                "ACTIX",
                List.of(result("ACTIX", "GraphQL", 200, 2, 3, 4)));

    var json = mapper.readTree(new JsonReportRenderer(mapper).render(report));

    assertEquals("AXUM", json.get("label_a").asText());
    assertEquals("2024-05-01T12:30:45Z", json.get("generated_at").asText());
    assertEquals("GraphQL", json.get("results_a").get(0).get("test_name").asText());
    assertEquals(300.0, json.get("average_a").get("requests_per_second").asDouble(), 1e-9);
    assertEquals(4, json.get("winners").size());
    assertEquals("THROUGHPUT", json.get("winners").get(0).get("metric").asText());
    assertEquals("AXUM", json.get("winners").get(0).get("winner").asText());
    assertEquals(50.0, json.get("winners").get(0).get("difference_percent").asDouble(), 1e-9);
  }

  @Test
  void render_missingSide_omitsNullAverage() throws Exception {
    var mapper = ObjectMapperConfig.create();
    var report = ComparisonReporterTest.reporter().compare("A", List.of(), "B", List.of());

    var json = mapper.readTree(new JsonReportRenderer(mapper).render(report));

    assertFalse(json.has("average_a"));
    assertEquals(0, json.get("results_a").size());
    assertEquals(0, json.get("winners").size());
  }
}
