package com.appraisehub.backend.util;

public class CacheKeyBuilder {

    private static final String SEPARATOR = ":";

    private CacheKeyBuilder() {
    }

    // Campaign progress report
    public static String progressKey(Long campaignId) {
        return String.format("appraisal_progress%s%d", SEPARATOR, campaignId);
    }

    // Every progress report, for bulk invalidation
    public static String progressPattern() {
        return String.format("appraisal_progress%s*", SEPARATOR);
    }
}
