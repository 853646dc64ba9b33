package com.yerin.collector.application;

import com.yerin.collector.domain.Annotation;
import com.yerin.collector.domain.Dataset;
import com.yerin.collector.service.DatasetItems;
import com.yerin.collector.service.DatasetService;

import java.nio.file.Path;
import java.util.*;

/**
 * 처리기 한 번의 실행 문맥. 파라미터는 민감 값이 지워지기 전의 스냅샷이다.
 */
public class ProcessorRun {

    private final WorkerJob job;
    private final Dataset dataset;
    private final Dataset source;
    private final Map<String, Object> parameters;
    private final DatasetService datasetService;
    private boolean finished;

    ProcessorRun(WorkerJob job, Dataset dataset, Dataset source, DatasetService datasetService) {
        this.job = job;
        this.dataset = dataset;
        this.source = source;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(dataset.getParameters()));
        this.datasetService = datasetService;
    }

    public Dataset dataset() { return dataset; }

    /** 부모 데이터셋. 최상위 데이터셋을 처리할 때는 null. */
    public Dataset source() { return source; }

    public Map<String, Object> parameters() { return parameters; }

    public String stringParameter(String name) {
        Object v = parameters.get(name);
        return v == null ? null : v.toString();
    }

    public boolean booleanParameter(String name, boolean defaultValue) {
        Object v = parameters.get(name);
        if (v == null) return defaultValue;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString());
    }

    public List<String> listParameter(String name, List<String> defaultValue) {
        Object v = parameters.get(name);
        if (v == null) return defaultValue;
        if (v instanceof Collection<?> c) return c.stream().map(String::valueOf).toList();
        String s = v.toString().trim();
        if (s.isEmpty()) return List.of();
        return Arrays.stream(s.split(",")).map(String::trim).filter(x -> !x.isEmpty()).toList();
    }

    public DatasetItems sourceItems() {
        if (source == null) throw new ProcessorException("This processor needs a source dataset");
        return datasetService.items(source);
    }

    public Path resultsPath(String extension) {
        return datasetService.assignResultsPath(dataset.getKey(), extension);
    }

    public void heartbeat() {
        job.heartbeat();
    }

    public void updateStatus(String status) {
        datasetService.updateStatus(dataset.getKey(), status);
    }

    public void writeSourceAnnotations(List<Annotation> annotations, boolean overwrite) {
        if (source == null) throw new ProcessorException("This processor needs a source dataset");
        datasetService.writeAnnotations(source.getKey(), annotations, overwrite);
    }

    public void finish(int numRows) {
        datasetService.finish(dataset.getKey(), numRows);
        finished = true;
    }

    public void finishWithError(String message) {
        datasetService.finishWithError(dataset.getKey(), message);
        finished = true;
    }

    public boolean isFinished() {
        return finished;
    }
}
