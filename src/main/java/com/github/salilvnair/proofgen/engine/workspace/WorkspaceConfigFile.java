package com.github.salilvnair.proofgen.engine.workspace;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Model of the workspace {@code ggen.toml}. Every section is optional.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkspaceConfigFile {

    private Project project = new Project();
    private Generation generation = new Generation();
    private Guards guards = new Guards();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Project {
        private String name;
        private String version;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Generation {
        private String outputDir;
        private List<String> ontologies = new ArrayList<>();
        private Boolean validate;
        private List<Rule> rules = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Rule {
        private String name;
        private String query;
        private String template;
        private String output;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Guards {
        private Boolean failFast;
        private Integer maxOutputFiles;
        private Long maxOutputBytes;
    }
}
