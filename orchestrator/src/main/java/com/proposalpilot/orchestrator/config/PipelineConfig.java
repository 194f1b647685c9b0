package com.proposalpilot.orchestrator.config;

import com.proposalpilot.orchestrator.graph.StageGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PipelineConfig {

    @Bean
    public StageGraph stageGraph() {
        return StageGraph.defaultGraph();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
