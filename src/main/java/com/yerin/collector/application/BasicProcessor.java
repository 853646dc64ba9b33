package com.yerin.collector.application;

import com.yerin.collector.domain.Dataset;
import com.yerin.collector.service.DatasetService;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Set;

/**
 * 데이터셋 하나를 처리하는 워커. 작업의 remoteId 가 처리 대상 데이터셋 키다.
 * <p>
 * 처리 결과는 finish(count) 또는 finishWithError(message) 로 데이터셋에 남는다.
 * 처리 중 실패는 데이터셋 오류로 기록되고 work() 밖으로 나가지 않는다.
 * sensitiveParameters() 의 값은 실행 스냅샷을 뜬 직후, process() 전에 저장된 파라미터에서 지워진다.
 * 그 삭제가 실패했으면 실행이 끝날 때 다시 시도한다.
 */
@Slf4j
public abstract class BasicProcessor extends BasicWorker {

    protected final DatasetService datasetService;

    protected BasicProcessor(DatasetService datasetService) {
        this.datasetService = datasetService;
    }

    /** 결과 파일 확장자 */
    public abstract String extension();

    public Set<String> sensitiveParameters() {
        return Set.of();
    }

    protected abstract void process(ProcessorRun run) throws Exception;

    @Override
    protected final void work(WorkerJob job) {
        Optional<Dataset> found = datasetService.find(job.getRemoteId());
        if (found.isEmpty()) {
            log.warn("[Processor.{}] dataset {} no longer exists, skip", type(), job.getRemoteId());
            return;
        }
        Dataset dataset = found.get();
        if (dataset.isFinished()) {
            log.info("[Processor.{}] dataset {} already finished, skip", type(), dataset.getKey());
            return;
        }

        Dataset source = dataset.isTopLevel() ? null : datasetService.find(dataset.getParentKey()).orElse(null);
        ProcessorRun run = new ProcessorRun(job, dataset, source, datasetService);
        boolean redacted = false;
        try {
            redactSensitive(dataset.getKey());
            redacted = true;
            if (!dataset.isTopLevel() && source == null) {
                throw new ProcessorException("Source dataset no longer exists");
            }
            process(run);
            if (!run.isFinished()) {
                log.warn("[Processor.{}] dataset {} not finished by processor, closing with 0 rows", type(), dataset.getKey());
                run.finish(0);
            }
        } catch (ProcessorException e) {
            run.finishWithError(e.getMessage());
        } catch (Exception e) {
            log.error("[Processor.{}] dataset {} failed", type(), dataset.getKey(), e);
            run.finishWithError("Processor failed: " + e.getMessage());
        } finally {
            if (!redacted) redactSensitive(dataset.getKey());
        }
    }

    private void redactSensitive(String key) {
        for (String name : sensitiveParameters()) {
            if (datasetService.deleteParameter(key, name)) {
                log.debug("[Processor.{}] removed sensitive parameter {} from {}", type(), name, key);
            }
        }
    }
}
