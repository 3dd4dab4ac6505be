package tech.compendium.pipeline.shared;

import com.github.f4b6a3.tsid.TsidCreator;

/**
 * Prefixed, time-sorted identifiers such as {@code job_0HZXEQ5Y8JY5Z}.
 *
 * <p>Identifiers with the same prefix sort by creation time, so listings can use the id
 * to break ties between jobs created in the same instant.
 */
public final class TsidGenerator {

    public static final String JOB_PREFIX = "job";

    public static String generate(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Prefix cannot be null or blank");
        }
        return prefix + "_" + TsidCreator.getTsid();
    }

    private TsidGenerator() {
    }
}
