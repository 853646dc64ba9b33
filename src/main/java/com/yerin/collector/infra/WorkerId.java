package com.yerin.collector.infra;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

/**
 * 이 프로세스가 점유한 작업을 표시하는 식별자 (host-uuid).
 */
public final class WorkerId {
    private WorkerId() {}

    public static String processName() {
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + UUID.randomUUID();
        } catch (UnknownHostException e) {
            return "worker-" + UUID.randomUUID();
        }
    }
}
