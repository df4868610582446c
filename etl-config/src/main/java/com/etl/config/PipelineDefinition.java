package com.etl.config;

import com.etl.core.ComponentRegistry;
import com.etl.core.Pipeline;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A parsed definition: the first stage and the stages chained after it. Each stage is applied to
 * a builder, the first to a fresh one, the others to {@link Pipeline#chain()} of the stage before.
 */
public record PipelineDefinition(String name, ComponentRegistry registry, List<Consumer<Pipeline.Builder>> stages) {
  public PipelineDefinition {
    name = Objects.requireNonNull(name, "name");
    registry = Objects.requireNonNull(registry, "registry");
    stages = List.copyOf(stages);
    if (stages.isEmpty()) throw new IllegalArgumentException("stages must not be empty");
  }

  /** The first stage, ready to run. */
  public Pipeline build() {
    Pipeline.Builder builder = Pipeline.builder(name).registry(registry);
    stages.get(0).accept(builder);
    return builder.build();
  }

  /** Runs every stage in order, each chained from the one before. Returns the last. */
  public Pipeline process() {
    Pipeline current = build().process();
    for (Consumer<Pipeline.Builder> stage : stages.subList(1, stages.size())) {
      current = current.chain(stage).process();
    }
    return current;
  }
}
