package com.polyglot.pipeline.transpile;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Target-specific configuration, shaped the way the matching executor needs
 * it. Produced fresh on every transpile call.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "target")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TranspiledConfig.DockerConfig.class,     name = "docker"),
        @JsonSubTypes.Type(value = TranspiledConfig.TerraformConfig.class,  name = "terraform"),
        @JsonSubTypes.Type(value = TranspiledConfig.KubernetesConfig.class, name = "kubernetes"),
        @JsonSubTypes.Type(value = TranspiledConfig.GitConfig.class,        name = "git"),
        @JsonSubTypes.Type(value = TranspiledConfig.BashConfig.class,       name = "bash"),
        @JsonSubTypes.Type(value = TranspiledConfig.SqlConfig.class,        name = "sql")
})
public sealed interface TranspiledConfig {

    /**
     * @param image        tag passed to {@code docker build -t}
     * @param buildCommand the command the executor runs, for display
     */
    record DockerConfig(String dockerfile, String image, String buildCommand) implements TranspiledConfig {}

    record TerraformConfig(String configuration, Map<String, Object> variables,
                           String planCommand, String applyCommand) implements TranspiledConfig {
        public TerraformConfig {
            variables = Map.copyOf(variables);
        }
    }

    record KubernetesConfig(List<String> manifests, String namespace, String applyCommand)
            implements TranspiledConfig {
        public KubernetesConfig {
            manifests = List.copyOf(manifests);
        }
    }

    /**
     * @param files        path to content, in document order
     * @param initCommands shell commands run in the materialised directory
     */
    record GitConfig(Map<String, String> files, List<String> initCommands) implements TranspiledConfig {
        public GitConfig {
            files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
            initCommands = List.copyOf(initCommands);
        }
    }

    record BashConfig(String script, String shebang, Map<String, String> environment)
            implements TranspiledConfig {
        public BashConfig {
            environment = Map.copyOf(environment);
        }
    }

    /**
     * @param statements individual statements, terminators stripped
     * @param database   connection string, or null for the executor default
     */
    record SqlConfig(List<String> statements, String database) implements TranspiledConfig {
        public SqlConfig {
            statements = List.copyOf(statements);
        }
    }
}
