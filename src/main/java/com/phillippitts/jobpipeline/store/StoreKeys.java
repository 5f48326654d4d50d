package com.phillippitts.jobpipeline.store;

/**
 * Key layout in the coordination store.
 */
public final class StoreKeys {

    /** Set of every job id that still has a record. */
    public static final String JOB_INDEX = "jobs:index";

    /** Sorted set of runnable job ids, scored by ready time in epoch millis. */
    public static final String JOB_QUEUE = "jobs:queue";

    private static final String JOB_PREFIX = "job:";
    private static final String OWNER_INDEX_PREFIX = "jobs:owner:";
    private static final String RATE_LIMIT_PREFIX = "rate_limit:";
    private static final String SESSION_PREFIX = "session:";

    private StoreKeys() {
    }

    public static String job(String jobId) {
        return JOB_PREFIX + jobId;
    }

    /** Set of the job ids submitted by one owner. */
    public static String ownerIndex(String ownerId) {
        return OWNER_INDEX_PREFIX + ownerId;
    }

    public static String rateLimit(String key) {
        return RATE_LIMIT_PREFIX + key;
    }

    public static String session(String sessionId) {
        return SESSION_PREFIX + sessionId;
    }
}
