package com.yerin.collector.service;

import com.yerin.collector.config.CollectorProperties;
import com.yerin.collector.domain.Annotation;
import com.yerin.collector.domain.Dataset;
import com.yerin.collector.domain.JobQueuePort;
import com.yerin.collector.domain.JobRef;
import com.yerin.collector.global.exception.AppException;
import com.yerin.collector.global.exception.code.DatasetErrorCode;
import com.yerin.collector.repository.AnnotationRepository;
import com.yerin.collector.repository.DatasetRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetService {

    private final DatasetRepository datasetRepository;
    private final AnnotationRepository annotationRepository;
    private final JobQueuePort queue;
    private final CollectorProperties properties;

    /**
     * 자식 데이터셋은 부모의 datasource 를 물려받는다.
     * 부모 행을 잠그므로 진행 중인 부모 삭제와 겹치면 삭제가 끝난 뒤 DATASET_NOT_FOUND 가 된다.
     */
    @Transactional
    public Dataset create(String type, Map<String, Object> parameters, String parentKey, String owner) {
        Map<String, Object> params = new LinkedHashMap<>(parameters == null ? Map.of() : parameters);
        if (parentKey != null && !parentKey.isEmpty()) {
            Dataset parent = datasetRepository.lockByKey(parentKey)
                    .orElseThrow(() -> new AppException(DatasetErrorCode.DATASET_NOT_FOUND));
            if (!params.containsKey(Dataset.PARAM_DATASOURCE) && parent.getDatasource() != null) {
                params.put(Dataset.PARAM_DATASOURCE, parent.getDatasource());
            }
        }
        Dataset dataset = Dataset.builder()
                .key(UUID.randomUUID().toString().replace("-", ""))
                .parentKey(parentKey)
                .type(type)
                .owner(owner)
                .parameters(params)
                .build();
        datasetRepository.save(dataset);
        log.info("[Dataset] created key={}, type={}, parent={}, owner={}", dataset.getKey(), type, parentKey, owner);
        return dataset;
    }

    /** 데이터셋 키당 처리 작업은 하나만 대기한다. */
    public JobRef queueProcessing(Dataset dataset) {
        return queue.enqueueIfAbsent(dataset.getType(), dataset.getKey(), 0);
    }

    @Transactional(readOnly = true)
    public Optional<Dataset> find(String key) {
        return datasetRepository.findById(key);
    }

    @Transactional(readOnly = true)
    public Dataset get(String key) {
        return datasetRepository.findById(key)
                .orElseThrow(() -> new AppException(DatasetErrorCode.DATASET_NOT_FOUND));
    }

    @Transactional
    public boolean deleteParameter(String key, String name) {
        return datasetRepository.findById(key)
                .map(d -> d.removeParameter(name))
                .orElse(false);
    }

    @Transactional
    public void updateStatus(String key, String status) {
        datasetRepository.findById(key).ifPresent(d -> d.updateStatus(status));
    }

    @Transactional
    public void finish(String key, int numRows) {
        datasetRepository.findById(key).ifPresent(d -> {
            d.finish(numRows);
            log.info("[Dataset] finished key={}, rows={}", key, numRows);
        });
    }

    @Transactional
    public void finishWithError(String key, String message) {
        datasetRepository.findById(key).ifPresent(d -> {
            d.updateStatus(message);
            d.finish(0);
            log.info("[Dataset] finished with error key={}, message={}", key, message);
        });
    }

    @Transactional
    public void writeAnnotations(String key, List<Annotation> annotations, boolean overwrite) {
        if (annotations.isEmpty()) return;
        if (overwrite) {
            Set<String> labels = annotations.stream().map(Annotation::getLabel).collect(Collectors.toSet());
            annotationRepository.deleteByDatasetKeyAndLabelIn(key, labels);
        }
        annotations.forEach(a -> a.setDatasetKey(key));
        annotationRepository.saveAll(annotations);
    }

    @Transactional(readOnly = true)
    public List<Annotation> annotations(String key) {
        return annotationRepository.findByDatasetKeyOrderByIdAsc(key);
    }

    /**
     * 결과 파일 경로를 정하고 데이터셋에 기록한다.
     */
    @Transactional
    public Path assignResultsPath(String key, String extension) {
        Dataset dataset = get(key);
        String file = key + "." + extension;
        dataset.assignResultFile(file);
        return dataDirectory().resolve(file);
    }

    public Path resultsPath(Dataset dataset) {
        return dataset.getResultFile() == null ? null : dataDirectory().resolve(dataset.getResultFile());
    }

    public DatasetItems items(Dataset dataset) {
        return new DatasetItems(resultsPath(dataset));
    }

    /**
     * 데이터셋과 모든 하위 데이터셋을 한 트랜잭션에서 지운다. 결과 파일은 커밋 후에 지운다.
     * 없는 키면 아무것도 하지 않고 false.
     */
    @Transactional
    public boolean delete(String key) {
        if (datasetRepository.lockByKey(key).isEmpty()) {
            log.debug("[Dataset] delete skipped, key={} not found", key);
            return false;
        }
        List<String> keys = subtreeChildrenFirst(key);
        List<String> files = datasetRepository.findResultFilesByKeyIn(keys);

        annotationRepository.deleteByDatasetKeyIn(keys);
        int cancelled = queue.cancelQueued(keys);
        int deleted = datasetRepository.deleteByKeyIn(keys);

        afterCommit(() -> deleteFiles(files));
        log.info("[Dataset] deleted key={} with {} descendant(s), cancelledJobs={}", key, deleted - 1, cancelled);
        return true;
    }

    /**
     * parent_key 를 따라가는 반복 DFS. 자식이 항상 부모보다 앞에 온다.
     * 방문하는 행마다 자식을 읽기 전에 잠가서 그 아래에 새 자식이 생기지 못하게 한다.
     */
    List<String> subtreeChildrenFirst(String rootKey) {
        List<String> preOrder = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(rootKey);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!seen.add(current)) continue;
            if (!current.equals(rootKey) && datasetRepository.lockByKey(current).isEmpty()) continue;
            preOrder.add(current);
            for (String child : datasetRepository.findKeysByParentKey(current)) {
                if (!seen.contains(child)) stack.push(child);
            }
        }
        Collections.reverse(preOrder);
        return preOrder;
    }

    private Path dataDirectory() {
        return Path.of(properties.getPathData());
    }

    private void deleteFiles(List<String> files) {
        for (String file : files) {
            Path path = dataDirectory().resolve(file);
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("[Dataset] could not delete result file {}, err={}", path, e.toString());
            }
        }
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
