package com.bountyscope.core.triage;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class TriageConfig {

    @Bean
    public FindingClassifier findingClassifier(TriageProperties properties) {
        String modelPath = properties.getModelPath();
        if (modelPath == null || modelPath.isBlank()) {
            return LogisticTextClassifier.untrained();
        }
        return LogisticTextClassifier.load(Path.of(modelPath));
    }
}
