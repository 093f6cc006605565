package com.whereq.gridx.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.gridx.config.GridxProperties;
import com.whereq.gridx.model.Worker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConfiguredWorkerDirectoryTest {

    @TempDir
    Path tempDir;

    private GridxProperties properties;
    private ConfiguredWorkerDirectory directory;

    @BeforeEach
    void setUp() {
        properties = new GridxProperties();
        directory = new ConfiguredWorkerDirectory(properties, new ObjectMapper());
    }

    private void peer(String name, String ip, int gpus) {
        GridxProperties.PeerConfig peer = new GridxProperties.PeerConfig();
        peer.setIp(ip);
        peer.setGpus(gpus);
        properties.getWorkers().getPeers().put(name, peer);
    }

    @Test
    void configuredPeersKeepTheirOrder() {
        peer("gpu-box", "10.0.0.2", 2);
        peer("cpu-box", "10.0.0.3", 0);
        peer("broken", " ", 0);

        List<Worker> workers = directory.loadWorkers();

        assertThat(workers).extracting(Worker::getName).containsExactly("gpu-box", "cpu-box");
        assertThat(workers.get(0).getGpus()).isEqualTo(2);
    }

    @Test
    void hubConfigOverridesInlinePeers() throws IOException {
        peer("gpu-box", "10.0.0.2", 2);
        Path hubConfig = tempDir.resolve("hub_config.json");
        Files.writeString(hubConfig, """
            {
              "peers": {
                "gpu-box": {"ip": "10.0.0.20", "cpus": 32, "memory": "128GB", "gpus": 4},
                "laptop": {"ip": "10.0.0.30"},
                "no-ip": {"cpus": 8}
              }
            }
            """);
        properties.getWorkers().setHubConfig(hubConfig.toString());

        List<Worker> workers = directory.loadWorkers();

        assertThat(workers).extracting(Worker::getName).containsExactly("gpu-box", "laptop");
        Worker gpuBox = workers.get(0);
        assertThat(gpuBox.getIp()).isEqualTo("10.0.0.20");
        assertThat(gpuBox.getCpus()).isEqualTo(32);
        assertThat(gpuBox.getMemory()).isEqualTo("128GB");
        assertThat(gpuBox.getGpus()).isEqualTo(4);
        assertThat(workers.get(1).getCpus()).isNull();
        assertThat(workers.get(1).getGpus()).isZero();
    }

    @Test
    void missingOrMalformedHubConfigFallsBackToPeers() throws IOException {
        peer("cpu-box", "10.0.0.3", 0);
        properties.getWorkers().setHubConfig(tempDir.resolve("absent.json").toString());

        assertThat(directory.loadWorkers()).extracting(Worker::getName).containsExactly("cpu-box");

        Path malformed = tempDir.resolve("malformed.json");
        Files.writeString(malformed, "{ not json");
        properties.getWorkers().setHubConfig(malformed.toString());

        assertThat(directory.loadWorkers()).extracting(Worker::getName).containsExactly("cpu-box");
    }
}
