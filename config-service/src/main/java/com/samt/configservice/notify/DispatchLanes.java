package com.samt.configservice.notify;

import org.springframework.scheduling.concurrent.ExecutorConfigurationSupport;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Fixed set of single-threaded executors. A key always hashes to the same
 * lane, so events of one key are delivered in the order they were enqueued.
 */
public class DispatchLanes {

    private final List<? extends Executor> lanes;

    public DispatchLanes(List<? extends Executor> lanes) {
        if (lanes.isEmpty()) {
            throw new IllegalArgumentException("At least one dispatch lane is required");
        }
        this.lanes = List.copyOf(lanes);
    }

    public Executor laneFor(String key) {
        return lanes.get(Math.floorMod(key.hashCode(), lanes.size()));
    }

    public List<? extends Executor> executors() {
        return lanes;
    }

    public void shutdown() {
        for (Executor lane : lanes) {
            if (lane instanceof ExecutorConfigurationSupport executor) {
                executor.shutdown();
            }
        }
    }
}
