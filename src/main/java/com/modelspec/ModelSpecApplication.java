package com.modelspec;

import com.modelspec.config.ModelDefinition;
import com.modelspec.live.LiveModelResolver;
import com.modelspec.model.AssemblyResult;
import com.modelspec.model.FormulaRenderer;
import com.modelspec.model.ModelSpec;
import com.modelspec.model.ModelSpecAssembler;
import com.modelspec.spring.EnableModelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Example Spring Boot application resolving the configured model formula.
 */
@SpringBootApplication
@EnableModelSpec
public class ModelSpecApplication {

    private static final Logger log = LoggerFactory.getLogger(ModelSpecApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ModelSpecApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(ModelDefinition definition, ModelSpecAssembler assembler,
                                  LiveModelResolver liveResolver) {
        return args -> {
            log.info("=== Model '{}' ===", definition.name());

            String formula = args.length > 0 ? String.join(" ", args) : definition.formula();
            AssemblyResult result = assembler.assemble(formula);

            if (result.isSuccess()) {
                ModelSpec spec = result.getModelSpec().orElseThrow();
                log.info("Formula:     {}", FormulaRenderer.render(spec, assembler.getSyntax()));
                log.info("Terms:       {}", spec.termLabels());
                log.info("Variables:   {}", FormulaRenderer.variableTypes(spec));
                log.info("Correlable:  {}", spec.correlableVariables());
                log.info("Mixed model: {}", spec.isMixedModel());
            } else {
                log.info("Resolution of '{}' ended with {}", formula, result);
            }

            // Programmatic set, bypasses the debounce window
            liveResolver.resolveNow(formula);
        };
    }
}
