package com.yerin.collector.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 워커에 주입되는 설정. 스케줄러 튜닝 값은 각 컴포넌트에서 @Value 로 읽는다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "collector")
public class CollectorProperties {

    /** .current-version 파일이 있는 설치 루트 */
    private String pathRoot = ".";

    /** 데이터셋 결과 파일 디렉터리 */
    private String pathData = "data";

    /** 업데이트 확인에 쓰는 GitHub 저장소 URL. 비어 있으면 확인하지 않는다. */
    private String githubUrl = "";

    /** datasource id → 만료 설정 */
    private Map<String, Datasource> datasources = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Datasource {
        /** 최상위 데이터셋 보존 기간(초). 0 이면 만료 없음. */
        private long timeout;
    }
}
