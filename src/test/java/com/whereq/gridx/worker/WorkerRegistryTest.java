package com.whereq.gridx.worker;

import com.whereq.gridx.exception.WorkerNotFoundException;
import com.whereq.gridx.model.Worker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerRegistryTest {

    private static Worker worker(String name) {
        return Worker.builder().name(name).ip("192.168.1.10").build();
    }

    @Test
    void refreshReplacesTheSnapshot() {
        List<Worker> source = new ArrayList<>(List.of(worker("w1")));
        WorkerRegistry registry = new WorkerRegistry(() -> source);
        registry.initialize();

        List<Worker> before = registry.snapshot();
        source.add(worker("w2"));
        registry.refresh();

        assertThat(before).extracting(Worker::getName).containsExactly("w1");
        assertThat(registry.snapshot()).extracting(Worker::getName).containsExactly("w1", "w2");
        assertThat(registry.get("w2").getIp()).isEqualTo("192.168.1.10");
    }

    @Test
    void failedRefreshKeepsPreviousSnapshot() {
        List<Worker> initial = List.of(worker("w1"));
        boolean[] broken = {false};
        WorkerRegistry registry = new WorkerRegistry(() -> {
            if (broken[0]) {
                throw new IllegalStateException("directory unavailable");
            }
            return initial;
        });
        registry.initialize();

        broken[0] = true;
        registry.refresh();

        assertThat(registry.snapshot()).extracting(Worker::getName).containsExactly("w1");
    }

    @Test
    void unknownWorkerIsReported() {
        WorkerRegistry registry = new WorkerRegistry(List::of);
        registry.initialize();

        assertThat(registry.find("ghost")).isEmpty();
        assertThatThrownBy(() -> registry.get("ghost"))
            .isInstanceOf(WorkerNotFoundException.class)
            .hasMessage("Worker 'ghost' not found");
    }
}
