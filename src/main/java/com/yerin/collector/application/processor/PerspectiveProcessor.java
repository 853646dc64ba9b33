package com.yerin.collector.application.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yerin.collector.application.BasicProcessor;
import com.yerin.collector.application.ProcessorException;
import com.yerin.collector.application.ProcessorRun;
import com.yerin.collector.domain.Annotation;
import com.yerin.collector.external.PerspectiveClient;
import com.yerin.collector.service.DatasetService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Perspective API 로 아이템 본문의 독성(toxicity) 등 점수를 매긴다.
 */
@Slf4j
@Component
public class PerspectiveProcessor extends BasicProcessor {

    public static final String TYPE = "perspective";

    static final String PARAM_API_KEY = "api_key";
    static final String PARAM_ATTRIBUTES = "attributes";
    static final String PARAM_WRITE_ANNOTATIONS = "write_annotations";

    static final List<String> ALL_ATTRIBUTES = List.of(
            "TOXICITY", "SEVERE_TOXICITY", "IDENTITY_ATTACK", "INSULT", "PROFANITY", "THREAT");

    private final PerspectiveClient client;
    private final ObjectMapper om;

    @Value("${collector.perspective.max-workers:2}")
    private int maxWorkers = 2;

    public PerspectiveProcessor(DatasetService datasetService, PerspectiveClient client, ObjectMapper om) {
        super(datasetService);
        this.client = client;
        this.om = om;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public int maxWorkers() {
        return maxWorkers;
    }

    @Override
    public String extension() {
        return "ndjson";
    }

    @Override
    public Set<String> sensitiveParameters() {
        return Set.of(PARAM_API_KEY);
    }

    @Override
    protected void process(ProcessorRun run) throws IOException {
        String apiKey = run.stringParameter(PARAM_API_KEY);
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProcessorException("You need to provide a valid API key");
        }

        List<String> attributes = run.listParameter(PARAM_ATTRIBUTES, List.of("TOXICITY"));
        if (attributes.isEmpty()) {
            throw new ProcessorException("You need to provide at least one attribute to score");
        }
        for (String attribute : attributes) {
            if (!ALL_ATTRIBUTES.contains(attribute)) {
                throw new ProcessorException("Unknown attribute " + attribute);
            }
        }
        boolean writeAnnotations = run.booleanParameter(PARAM_WRITE_ANNOTATIONS, true);

        List<ObjectNode> results = new ArrayList<>();
        List<Annotation> annotations = new ArrayList<>();

        try (Stream<Map<String, Object>> items = run.sourceItems().stream()) {
            Iterator<Map<String, Object>> it = items.iterator();
            while (it.hasNext()) {
                Map<String, Object> item = it.next();
                Object body = item.get("body");
                if (body == null || body.toString().isEmpty()) continue;
                String itemId = String.valueOf(item.get("id"));

                JsonNode response;
                try {
                    response = client.analyze(apiKey, body.toString(), attributes);
                } catch (RestClientException e) {
                    run.updateStatus(e.getMessage());
                    continue;
                }
                if (!(response instanceof ObjectNode scored)) continue;

                ObjectNode result = scored.deepCopy();
                result.put("item_id", itemId);
                result.put("body", body.toString());
                results.add(result);

                if (writeAnnotations) {
                    for (String attribute : attributes) {
                        JsonNode value = response.path("attributeScores").path(attribute).path("summaryScore").path("value");
                        if (value.isMissingNode()) continue;
                        annotations.add(Annotation.builder()
                                .itemId(itemId)
                                .label(attribute)
                                .value(value.asText())
                                .build());
                    }
                }
                run.heartbeat();
            }
        }

        if (writeAnnotations) {
            run.writeSourceAnnotations(annotations, true);
        }

        Path out = run.resultsPath(extension());
        if (out.getParent() != null) Files.createDirectories(out.getParent());
        try (BufferedWriter writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            for (ObjectNode result : results) {
                writer.write(om.writeValueAsString(result));
                writer.write("\n");
            }
        }

        log.info("[Processor.{}] scored {} item(s) for dataset {}", TYPE, results.size(), run.dataset().getKey());
        run.finish(results.size());
    }

    /**
     * 결과 한 줄을 item_id, body, 속성별 점수로 평탄화한다.
     */
    public static Map<String, Object> mapItem(JsonNode result) {
        Map<String, Object> mapped = new LinkedHashMap<>();
        mapped.put("item_id", result.path("item_id").asText());
        mapped.put("body", result.path("body").asText(null));
        for (String attribute : ALL_ATTRIBUTES) {
            JsonNode value = result.path("attributeScores").path(attribute).path("summaryScore").path("value");
            if (!value.isMissingNode()) mapped.put(attribute, value.asDouble());
        }
        return mapped;
    }
}
