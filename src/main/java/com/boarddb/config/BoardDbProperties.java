package com.boarddb.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "boarddb")
public class BoardDbProperties {

    private String output = "boards.cfg";
    private String configDir = "configs";
    private String srcDir = ".";
    private int jobs = Runtime.getRuntime().availableProcessors();
    private boolean warnTargets = false;
    private Scan scan = new Scan();
    private Evaluator evaluator = new Evaluator();

    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }
    public String getConfigDir() { return configDir; }
    public void setConfigDir(String configDir) { this.configDir = configDir; }
    public String getSrcDir() { return srcDir; }
    public void setSrcDir(String srcDir) { this.srcDir = srcDir; }
    public int getJobs() { return jobs; }
    public void setJobs(int jobs) { this.jobs = jobs; }
    public boolean isWarnTargets() { return warnTargets; }
    public void setWarnTargets(boolean warnTargets) { this.warnTargets = warnTargets; }

    // -- Scan accessors (delegate to nested) --
    public long getPollIntervalMs() { return scan.pollIntervalMs; }

    public Scan getScan() { return scan; }
    public void setScan(Scan scan) { this.scan = scan; }
    public Evaluator getEvaluator() { return evaluator; }
    public void setEvaluator(Evaluator evaluator) { this.evaluator = evaluator; }

    public static class Scan {
        /**
         * Longest time the coordinator waits between two drains of the worker
         * result queues.
         */
        private long pollIntervalMs = 30;

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    public static class Evaluator {
        /** Symbol values in effect before each fragment is loaded, without the CONFIG_ prefix. */
        private Map<String, String> defaults = new LinkedHashMap<>();

        public Map<String, String> getDefaults() { return defaults; }
        public void setDefaults(Map<String, String> defaults) { this.defaults = defaults; }
    }
}
