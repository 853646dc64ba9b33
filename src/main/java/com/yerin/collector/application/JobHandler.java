package com.yerin.collector.application;

import java.util.Optional;

public interface JobHandler {

    String type();

    default int maxWorkers() {
        return 1;
    }

    default Optional<EnsureJob> ensureJob() {
        return Optional.empty();
    }

    void handle(WorkerJob job) throws Exception;
}
