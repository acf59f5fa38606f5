package com.linlay.assistantgw.stream.service;

import java.util.concurrent.ThreadLocalRandom;

public final class RunIdGenerator {

    private RunIdGenerator() {
    }

    public static String nextRunId() {
        return encode(System.currentTimeMillis(), ThreadLocalRandom.current().nextInt(36 * 36 * 36 * 36));
    }

    static String encode(long epochMillis, int salt) {
        long normalized = epochMillis > 0 ? epochMillis : System.currentTimeMillis();
        String suffix = Integer.toString(Math.floorMod(salt, 36 * 36 * 36 * 36), 36);
        return "run_" + Long.toString(normalized, 36) + "0000".substring(suffix.length()) + suffix;
    }
}
