package com.celesteos.core.logging;

import org.slf4j.MDC;

/**
 * Router MDC keys for structured logging. Query text is never put in the MDC.
 */
public final class MdcContext {

    public static final String QUERY_ID = "queryId";
    public static final String LANE = "lane";

    private MdcContext() {}

    public static void setQuery(String queryId) {
        MDC.put(QUERY_ID, queryId);
    }

    public static void setLane(String queryId, String lane) {
        MDC.put(QUERY_ID, queryId);
        MDC.put(LANE, lane);
    }

    public static void clear() {
        MDC.remove(QUERY_ID);
        MDC.remove(LANE);
    }
}
