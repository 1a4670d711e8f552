package com.provenant.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "provenant.sandbox")
public class SandboxProperties {

    private String provider = "docker";
    private int memoryLimitMb = 4096;
    private int cpuCount = 2;

    /** Docker network with egress restricted to the dependency mirror. */
    private String mirrorNetwork = "provenant-mirror";

    /** Path inside the sandbox where the output directory is mounted. */
    private String outputMount = "/out";

    /** Independent builder nodes; each should run on separate hardware. */
    private List<Node> nodes = new ArrayList<>();

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public int getMemoryLimitMb() { return memoryLimitMb; }
    public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    public int getCpuCount() { return cpuCount; }
    public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
    public String getMirrorNetwork() { return mirrorNetwork; }
    public void setMirrorNetwork(String mirrorNetwork) { this.mirrorNetwork = mirrorNetwork; }
    public String getOutputMount() { return outputMount; }
    public void setOutputMount(String outputMount) { this.outputMount = outputMount; }
    public List<Node> getNodes() { return nodes; }
    public void setNodes(List<Node> nodes) { this.nodes = nodes; }

    public static class Node {
        private String id;
        private String dockerHost = "unix:///var/run/docker.sock";

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    }
}
