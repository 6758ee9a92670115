package com.modelspec.config;

import com.modelspec.data.DataProvider;
import com.modelspec.data.InMemoryDataProvider;
import com.modelspec.design.FactorDefinition;
import com.modelspec.design.FactorDesign;
import com.modelspec.exception.ConfigurationException;
import com.modelspec.variable.LevelLabels;
import com.modelspec.variable.ManualVariableConfig;
import com.modelspec.variable.VariableKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads model definitions from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load a model definition from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded definition
     */
    public static ModelDefinition load(String path) {
        log.info("Loading model definition from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(new Yaml().load(inputStream));
            }
        } catch (IOException | YAMLException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse a model definition from YAML text.
     */
    public static ModelDefinition fromYaml(String yamlText) {
        try {
            return parseYaml(new Yaml().load(yamlText));
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid model definition YAML", e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static ModelDefinition parseYaml(Object loaded) {
        if (!(loaded instanceof Map<?, ?>)) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // Get the model section (could be at root or under 'model' key)
        Map<String, Object> modelConfig = root.containsKey("model")
                ? (Map<String, Object>) root.get("model")
                : root;
        if (modelConfig == null) {
            throw new ConfigurationException("Configuration section 'model' is empty");
        }

        String name = getString(modelConfig, "name", "default-model");
        String formula = getString(modelConfig, "formula", null);

        Map<String, ManualVariableConfig> variables =
                parseVariables((Map<String, Object>) modelConfig.get("variables"));
        DataProvider data = parseData((Map<String, Object>) modelConfig.get("data"));
        FactorDesign design = parseFactorDesign(
                (List<Map<String, Object>>) modelConfig.get("factors"),
                (List<Object>) modelConfig.get("interactions"));

        if ((formula == null || formula.isBlank()) && design == null) {
            log.warn("Model '{}' defines neither a formula nor factors", name);
        }

        ModelDefinition definition = new ModelDefinition(name, formula, variables, data, design);

        log.info("Loaded model definition: {} with formula '{}', {} configured variables, {} data columns{}",
                name, definition.formula(), variables.size(), data.columnNames().size(),
                design != null ? ", factor design with " + design.factors().size() + " factors" : "");

        return definition;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ManualVariableConfig> parseVariables(Map<String, Object> variablesMap) {
        Map<String, ManualVariableConfig> variables = new LinkedHashMap<>();
        if (variablesMap == null) {
            return variables;
        }

        for (Map.Entry<String, Object> entry : variablesMap.entrySet()) {
            String variable = entry.getKey();
            Object value = entry.getValue();

            ManualVariableConfig config;
            if (value == null) {
                config = ManualVariableConfig.continuous();
            } else if (value instanceof Map<?, ?>) {
                config = parseVariable(variable, (Map<String, Object>) value);
            } else {
                // Shorthand: "x: binary"
                config = new ManualVariableConfig(VariableKind.fromConfig(value.toString()), null, null, null);
            }
            variables.put(variable, config);
            log.debug("Parsed variable '{}' as {}", variable, config.kind());
        }
        return variables;
    }

    private static ManualVariableConfig parseVariable(String variable, Map<String, Object> map) {
        VariableKind kind = VariableKind.fromConfig(getString(map, "type", null));
        Integer levelCount = map.containsKey("n-levels") ? getInt(map, "n-levels", 0) : null;
        List<String> labels = getStringList(map, "level-labels");
        String reference = getString(map, "reference", null);

        if (kind == VariableKind.CONTINUOUS && (levelCount != null || !labels.isEmpty())) {
            throw new ConfigurationException(variable,
                    "Continuous variable '" + variable + "' cannot declare levels");
        }
        return new ManualVariableConfig(kind, levelCount, labels, reference);
    }

    private static DataProvider parseData(Map<String, Object> dataMap) {
        if (dataMap == null || dataMap.isEmpty()) {
            return DataProvider.none();
        }
        Map<String, List<?>> columns = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : dataMap.entrySet()) {
            if (!(entry.getValue() instanceof List<?> values)) {
                throw new ConfigurationException(entry.getKey(),
                        "Data column '" + entry.getKey() + "' must be a list of values");
            }
            columns.put(entry.getKey(), values);
        }
        return InMemoryDataProvider.fromValues(columns);
    }

    private static FactorDesign parseFactorDesign(List<Map<String, Object>> factorsList, List<Object> interactionsList) {
        if (factorsList == null || factorsList.isEmpty()) {
            if (interactionsList != null && !interactionsList.isEmpty()) {
                throw new ConfigurationException("Interactions are configured but no factors are defined");
            }
            return null;
        }

        List<FactorDefinition> factors = new ArrayList<>();
        for (int i = 0; i < factorsList.size(); i++) {
            Map<String, Object> factorMap = factorsList.get(i);
            String name = getString(factorMap, "name", null);
            if (name == null) {
                throw new ConfigurationException("Factor " + i + " has no name");
            }
            List<String> labels = getStringList(factorMap, "level-labels");
            int nLevels = getInt(factorMap, "n-levels", labels.isEmpty() ? ManualVariableConfig.DEFAULT_FACTOR_LEVELS : labels.size());
            String reference = getString(factorMap, "reference", null);
            factors.add(new FactorDefinition(name, nLevels, labels, reference));
        }

        List<String> interactions = new ArrayList<>();
        if (interactionsList != null) {
            for (Object interaction : interactionsList) {
                interactions.add(interaction.toString().replace(" ", ""));
            }
        }
        return new FactorDesign(factors, interactions);
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for '" + key + "': " + value, e);
        }
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return List.of();
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(key, "'" + key + "' must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            result.add(LevelLabels.label(item));
        }
        return result;
    }
}
