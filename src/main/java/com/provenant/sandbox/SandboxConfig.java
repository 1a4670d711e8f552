package com.provenant.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.provenant.core.error.ErrorCode;
import com.provenant.core.error.ProvenantException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class SandboxConfig {

    @Bean
    @ConditionalOnProperty(name = "provenant.sandbox.provider", havingValue = "docker", matchIfMissing = true)
    public SandboxPool dockerSandboxPool(SandboxProperties properties) {
        if (properties.getNodes().isEmpty()) {
            throw new ProvenantException(ErrorCode.INVALID_CONFIG, "provenant.sandbox.nodes must list at least one builder");
        }
        var nodes = new ArrayList<BuilderNode>();
        for (SandboxProperties.Node node : properties.getNodes()) {
            var provider = new DockerSandboxProvider(dockerClient(node.getDockerHost()),
                    properties.getMirrorNetwork(), properties.getOutputMount());
            nodes.add(new BuilderNode(node.getId(), provider));
        }
        return new SandboxPool(List.copyOf(nodes));
    }

    // One client per node; nodes are separate Docker hosts
    static DockerClient dockerClient(String dockerHost) {
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support (no junixsocket needed)
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }
}
