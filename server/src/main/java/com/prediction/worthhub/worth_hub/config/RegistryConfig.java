package com.prediction.worthhub.worth_hub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.worthhub.worth_hub.engine.TopicStateMachine;
import com.prediction.worthhub.worth_hub.execution.InstructionProcessor;
import com.prediction.worthhub.worth_hub.execution.TopicExecutionRegistry;

@Configuration
public class RegistryConfig {

    @Bean
    public InstructionProcessor instructionProcessor(TopicStateMachine topicStateMachine) {
        return new InstructionProcessor(topicStateMachine);
    }

    @Bean(destroyMethod = "shutdown")
    public TopicExecutionRegistry topicExecutionRegistry(InstructionProcessor instructionProcessor) {
        return new TopicExecutionRegistry(instructionProcessor);
    }
}
