package com.provenant.core.build;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "provenant.build")
public class BuildProperties {

    private int builderTimeoutSeconds = 1800;
    private int jobTimeoutSeconds = 7200;
    private int retriesPerBuilder = 1;
    private int maxParallelSandboxes = 6;
    private int maxConcurrentJobs = 4;

    /** Build recipes by id. */
    private Map<String, Recipe> recipes = new LinkedHashMap<>();

    public int getBuilderTimeoutSeconds() { return builderTimeoutSeconds; }
    public void setBuilderTimeoutSeconds(int builderTimeoutSeconds) { this.builderTimeoutSeconds = builderTimeoutSeconds; }
    public int getJobTimeoutSeconds() { return jobTimeoutSeconds; }
    public void setJobTimeoutSeconds(int jobTimeoutSeconds) { this.jobTimeoutSeconds = jobTimeoutSeconds; }
    public int getRetriesPerBuilder() { return retriesPerBuilder; }
    public void setRetriesPerBuilder(int retriesPerBuilder) { this.retriesPerBuilder = retriesPerBuilder; }
    public int getMaxParallelSandboxes() { return maxParallelSandboxes; }
    public void setMaxParallelSandboxes(int maxParallelSandboxes) { this.maxParallelSandboxes = maxParallelSandboxes; }
    public int getMaxConcurrentJobs() { return maxConcurrentJobs; }
    public void setMaxConcurrentJobs(int maxConcurrentJobs) { this.maxConcurrentJobs = maxConcurrentJobs; }
    public Map<String, Recipe> getRecipes() { return recipes; }
    public void setRecipes(Map<String, Recipe> recipes) { this.recipes = recipes; }

    public static class Recipe {
        /** Builder image, pinned by digest in production. */
        private String image;
        private List<String> command = new ArrayList<>();
        /** Artifact location relative to the sandbox output directory. */
        private String artifactPath = "app.apk";
        /** Egress hosts the build may reach through the mirror network; empty means offline. */
        private List<String> networkAllowlist = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();

        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getArtifactPath() { return artifactPath; }
        public void setArtifactPath(String artifactPath) { this.artifactPath = artifactPath; }
        public List<String> getNetworkAllowlist() { return networkAllowlist; }
        public void setNetworkAllowlist(List<String> networkAllowlist) { this.networkAllowlist = networkAllowlist; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
    }
}
