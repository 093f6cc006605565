package com.whereq.gridx.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.gridx.config.GridxProperties;
import com.whereq.gridx.model.Worker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Workers from {@code gridx.workers.peers} merged with the {@code peers}
 * object of the hub configuration file. File entries replace inline entries
 * of the same name.
 */
@Slf4j
@Component
public class ConfiguredWorkerDirectory implements WorkerDirectory {

    private final GridxProperties properties;
    private final ObjectMapper objectMapper;

    public ConfiguredWorkerDirectory(GridxProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Worker> loadWorkers() {
        Map<String, Worker> workers = new LinkedHashMap<>();
        properties.getWorkers().getPeers().forEach((name, peer) -> {
            if (peer.getIp() == null || peer.getIp().isBlank()) {
                log.warn("Ignoring configured worker {} without ip", name);
                return;
            }
            workers.put(name, Worker.builder()
                .name(name)
                .ip(peer.getIp())
                .cpus(peer.getCpus())
                .memory(peer.getMemory())
                .gpus(peer.getGpus())
                .build());
        });
        workers.putAll(readHubConfig());
        return new ArrayList<>(workers.values());
    }

    private Map<String, Worker> readHubConfig() {
        Map<String, Worker> workers = new LinkedHashMap<>();
        String location = properties.getWorkers().getHubConfig();
        if (location == null || location.isBlank()) {
            return workers;
        }
        Path path = Path.of(location);
        if (!Files.isReadable(path)) {
            log.debug("Hub config {} not readable, using configured peers only", path);
            return workers;
        }
        try {
            JsonNode peers = objectMapper.readTree(path.toFile()).path("peers");
            Iterator<Map.Entry<String, JsonNode>> fields = peers.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                JsonNode peer = entry.getValue();
                String ip = peer.path("ip").asText(null);
                if (ip == null || ip.isBlank()) {
                    log.warn("Ignoring hub config peer {} without ip", entry.getKey());
                    continue;
                }
                workers.put(entry.getKey(), Worker.builder()
                    .name(entry.getKey())
                    .ip(ip)
                    .cpus(peer.hasNonNull("cpus") ? peer.get("cpus").asInt() : null)
                    .memory(peer.hasNonNull("memory") ? peer.get("memory").asText() : null)
                    .gpus(peer.path("gpus").asInt(0))
                    .build());
            }
        } catch (IOException e) {
            log.error("Failed to read hub config {}", path, e);
        }
        return workers;
    }
}
