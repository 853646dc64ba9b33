package com.yerin.collector.application;

import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class JobHandlerRegistry {
    private final Map<String, JobHandler> map;

    public JobHandlerRegistry(List<JobHandler> handlers) {
        for (JobHandler h : handlers) {
            if (h.maxWorkers() < 1) {
                throw new IllegalStateException("maxWorkers must be >= 1 for type=" + h.type());
            }
        }
        this.map = handlers.stream().collect(Collectors.toMap(JobHandler::type, Function.identity(),
                (a, b) -> { throw new IllegalStateException("duplicate worker type=" + a.type()); },
                TreeMap::new));
    }

    public JobHandler get(String type) { return map.get(type); }

    public Set<String> types() { return Collections.unmodifiableSet(map.keySet()); }

    public Collection<JobHandler> handlers() { return Collections.unmodifiableCollection(map.values()); }

    public Map<String, Integer> maxWorkersByType() {
        Map<String, Integer> out = new HashMap<>();
        map.forEach((type, h) -> out.put(type, h.maxWorkers()));
        return out;
    }

    /** 모든 타입의 동시 실행 상한 합. 실행 스레드 풀 크기로 쓴다. */
    public int totalWorkers() {
        return map.values().stream().mapToInt(JobHandler::maxWorkers).sum();
    }
}
