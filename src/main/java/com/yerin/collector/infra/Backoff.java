package com.yerin.collector.infra;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public final class Backoff {
    private Backoff() {}

    /**
     * base * 2^retryCount 를 cap 으로 자르고 ±jitterRatio 만큼 흔든다.
     */
    public static Duration expJitter(int retryCount, long baseMillis, long capMillis, double jitterRatio) {
        int exponent = Math.min(Math.max(0, retryCount), 30);
        long exp = (long) (baseMillis * Math.pow(2, exponent));
        long capped = Math.min(exp, capMillis);
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterRatio; // 1±r
        long withJitter = Math.max(0, (long) (capped * jitter));
        return Duration.ofMillis(withJitter);
    }
}
