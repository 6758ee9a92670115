package com.modelspec.adapter.spring;

import com.modelspec.config.ConfigLoader;
import com.modelspec.config.ModelDefinition;
import com.modelspec.formula.expression.FormulaSyntax;
import com.modelspec.live.LiveModelResolver;
import com.modelspec.model.ModelSpecAssembler;
import com.modelspec.variable.VariableResolver;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the model specification engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "modelspec", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ModelSpecProperties.class)
public class ModelSpecAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ModelSpecAutoConfiguration.class);

    private LiveModelResolver liveModelResolver;

    @Bean
    @ConditionalOnMissingBean
    public ModelDefinition modelDefinition(ModelSpecProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public VariableResolver variableResolver(ModelDefinition definition) {
        return definition.toVariableResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelSpecAssembler modelSpecAssembler(VariableResolver variableResolver, ModelSpecProperties properties) {
        FormulaSyntax syntax = FormulaSyntax.withMarker(properties.getInteractionMarker());
        log.info("Creating ModelSpecAssembler with interaction marker '{}'", syntax.interactionMarker());
        return new ModelSpecAssembler(variableResolver, syntax);
    }

    @Bean
    @ConditionalOnMissingBean
    public LiveModelResolver liveModelResolver(ModelSpecAssembler assembler, ModelSpecProperties properties) {
        log.info("Creating LiveModelResolver with {} ms debounce", properties.getDebounceMillis());
        this.liveModelResolver = new LiveModelResolver(assembler, properties.getDebounceMillis(),
                result -> log.info("Live resolution: {}", result));
        return this.liveModelResolver;
    }

    @PreDestroy
    public void shutdown() {
        if (liveModelResolver != null && !liveModelResolver.isClosed()) {
            log.info("Shutting down LiveModelResolver");
            liveModelResolver.close();
        }
    }
}
