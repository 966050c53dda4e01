package com.mk.fx.qa.benchmark.execution.resource;

import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.BenchmarkSubmissionRequest;
import com.mk.fx.qa.benchmark.execution.dto.controllerresponse.TargetRequest;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkRun;
import com.mk.fx.qa.benchmark.execution.model.BenchmarkTarget;
import com.mk.fx.qa.benchmark.execution.model.LoadProfile;
import com.mk.fx.qa.benchmark.execution.model.RunMode;
import com.mk.fx.qa.benchmark.execution.model.SuiteScenario;
import com.mk.fx.qa.benchmark.execution.scenarios.BenchmarkScenario;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(
    componentModel = "spring",
    imports = {UUID.class, Instant.class, LoadProfile.class})
public interface BenchmarkRunMapper {

  @Mapping(target = "id", expression = "java(UUID.randomUUID())")
  @Mapping(target = "createdAt", expression = "java(Instant.now())")
  @Mapping(target = "mode", source = "mode", qualifiedByName = "mapMode")
  @Mapping(
      target = "profile",
      expression =
          "java(new LoadProfile(request.getUsers(), request.getDurationSeconds(),"
              + " request.getRampUpSeconds()))")
  @Mapping(target = "scenarios", expression = "java(mapScenarios(request))")
  BenchmarkRun toDomain(BenchmarkSubmissionRequest request);

  BenchmarkTarget toTarget(TargetRequest request);

  List<BenchmarkTarget> toTargets(List<TargetRequest> requests);

  @Named("mapMode")
  default RunMode mapMode(String mode) {
    return RunMode.fromValue(mode);
  }

  /** Custom endpoints win over named scenarios; no scenario names means every built-in one. */
  @Named("mapScenarios")
  default List<SuiteScenario> mapScenarios(BenchmarkSubmissionRequest request) {
    if (request.getEndpoints() != null && !request.getEndpoints().isEmpty()) {
      return List.of(SuiteScenario.custom(request.getEndpoints()));
    }
    if (request.getScenarios() == null || request.getScenarios().isEmpty()) {
      return Arrays.stream(BenchmarkScenario.values()).map(SuiteScenario::of).toList();
    }
    return request.getScenarios().stream()
        .map(BenchmarkScenario::fromValue)
        .map(SuiteScenario::of)
        .toList();
  }
}
