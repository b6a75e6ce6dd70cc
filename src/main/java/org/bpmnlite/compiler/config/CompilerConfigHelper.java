package org.bpmnlite.compiler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

public class CompilerConfigHelper {
    private static final Logger log = LoggerFactory.getLogger(CompilerConfigHelper.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "bpmn-compiler.json";

    public static CompilerConfig loadConfigFile(String configFilePath) throws IOException {
        ObjectMapper mapper = new ObjectMapper();

        return mapper.readValue(new File(configFilePath), CompilerConfig.class);
    }

    /**
     * Loads the configuration bundled on the classpath.
     * Falls back to built-in defaults if the resource is absent.
     */
    public static CompilerConfig loadDefaults() throws IOException {
        try (InputStream is = CompilerConfigHelper.class.getClassLoader()
                .getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (is == null) {
                log.debug("No {} on classpath, using built-in defaults", DEFAULT_CONFIG_RESOURCE);
                return new CompilerConfig();
            }
            return new ObjectMapper().readValue(is, CompilerConfig.class);
        }
    }

    /**
     * Converts a loaded configuration into compiler options. Unset fields keep their defaults.
     */
    public static CompilerOptions toOptions(CompilerConfig config) {
        if (config == null) {
            return CompilerOptions.defaults();
        }
        return CompilerOptions.builder()
                .strictSchema(Boolean.TRUE.equals(config.strictSchema))
                .failOnUnresolvedErrorRef(Boolean.TRUE.equals(config.failOnUnresolvedErrorRef))
                .prettyPrintOutput(Boolean.TRUE.equals(config.prettyPrintOutput))
                .build();
    }
}
