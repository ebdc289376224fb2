package com.bountyscope.core.scope;

import com.bountyscope.core.config.ConfigurationException;
import com.bountyscope.core.model.ScopeDefinition;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads a program scope file of the form
 * {@code {"in_scope": [...], "out_of_scope": [...]}}.
 */
@Component
public class ScopeDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(ScopeDefinitionLoader.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Loads the scope file if a path was given.
     *
     * @return empty when {@code scopeFile} is null
     * @throws ConfigurationException if the file is missing, unreadable or not a scope document
     */
    public Optional<ScopeDefinition> load(Path scopeFile) {
        if (scopeFile == null) {
            return Optional.empty();
        }
        if (!Files.isRegularFile(scopeFile)) {
            throw new ConfigurationException("Scope file not found: " + scopeFile);
        }
        try {
            ScopeDefinition scope = mapper.readValue(scopeFile.toFile(), ScopeDefinition.class);
            if (scope == null) {
                throw new ConfigurationException("Scope file is empty: " + scopeFile);
            }
            if (scope.inScope().stream().anyMatch(p -> p == null || p.isBlank())
                    || scope.outOfScope().stream().anyMatch(p -> p == null || p.isBlank())) {
                throw new ConfigurationException("Scope file contains null or blank patterns: " + scopeFile);
            }
            log.info("Loaded scope from {}: {} in-scope, {} out-of-scope patterns",
                    scopeFile, scope.inScope().size(), scope.outOfScope().size());
            return Optional.of(scope);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid scope file " + scopeFile + ": " + e.getMessage(), e);
        }
    }
}
