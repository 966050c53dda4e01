package com.mk.fx.qa.benchmark.execution.dto.controllerresponse;

import com.mk.fx.qa.benchmark.execution.dto.EndpointDefinition;
import java.util.List;

/** A built-in scenario and its endpoint mix. */
public record ScenarioResponse(String name, String displayName, List<EndpointDefinition> endpoints) {}
