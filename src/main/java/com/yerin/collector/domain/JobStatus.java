package com.yerin.collector.domain;

import java.util.List;

public enum JobStatus {
    QUEUED,
    CLAIMED,
    RUNNING;

    /** 슬롯을 점유하고 있는 상태 */
    public static final List<JobStatus> ACTIVE = List.of(CLAIMED, RUNNING);
}
