package com.github.salilvnair.proofgen.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "proofgen")
@Getter
@Setter
public class ProofGenConfig {

    private String compilerVersion = "1.0.0";
    private Workspace workspace = new Workspace();
    private Guard guard = new Guard();
    private Receipt receipt = new Receipt();
    private Worker worker = new Worker();

    @Getter
    @Setter
    public static class Workspace {
        private String configFile = "ggen.toml";
        private String ontologyDir = "ontology";
        private String queryDir = "queries";
        private String templateDir = "templates";
        private String generatedRoot = "src/generated";
        private String stateFile = ".ggen/artifacts.json";
        private String receiptsDir = ".ggen/receipts";
        private String reportsDir = ".ggen/reports";
        private String diffsDir = ".ggen/diffs";
    }

    @Getter
    @Setter
    public static class Guard {
        private boolean failFast = true;
        private boolean parallelEvaluation = true;
        private boolean executeQueriesInValidateOnly = true;
        private int maxOutputFiles = 1000;
        private long maxOutputBytes = 100L * 1024 * 1024;
        private long maxFileBytes = 10L * 1024 * 1024;
        private long maxOntologyBytes = 50L * 1024 * 1024;
        private long maxTemplateBytes = 1024L * 1024;
        private long maxQueryBytes = 1024L * 1024;
    }

    @Getter
    @Setter
    public static class Receipt {
        private String signingKey;
        private long maxClockSkewSeconds = 300;
    }

    @Getter
    @Setter
    public static class Worker {
        private int threads = 0;
        private int queueCapacity = 1000;
        private long keepAliveSeconds = 60;
    }
}
