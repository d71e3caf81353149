package com.celesteos.core.engine;

import com.celesteos.core.logging.MdcContext;
import com.celesteos.core.metrics.RouterMetrics;
import com.celesteos.core.model.ClassificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Spring-facing wrapper around {@link QueryClassifier}: assigns a query id, sets the MDC
 * and records metrics. The classifier itself stays free of framework concerns.
 */
@Service
public class RoutingService {

    private static final Logger log = LoggerFactory.getLogger(RoutingService.class);

    private final QueryClassifier classifier;
    private final RouterMetrics metrics;

    public RoutingService(QueryClassifier classifier, RouterMetrics metrics) {
        this.classifier = classifier;
        this.metrics = metrics;
    }

    public ClassificationResult route(String query, Map<String, String> context) {
        String queryId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setQuery(queryId);
        try {
            ClassificationResult result = classifier.classify(query, context == null ? Map.of() : context);
            MdcContext.setLane(queryId, result.lane().name());

            metrics.recordLane(result.lane().name());
            metrics.recordDuration(result.metadata().latencyMs());
            if (stoppedBeforeLanes(result)) {
                metrics.recordGuardHit(result.laneReason());
            } else {
                metrics.recordEntityCount(result.metadata().entityCount());
            }
            log.info("Query routed: lane={} reason={} entities={} latency={}ms",
                    result.lane(), result.laneReason(), result.metadata().entityCount(),
                    result.metadata().latencyMs());
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    private static boolean stoppedBeforeLanes(ClassificationResult result) {
        return !result.metadata().modulesRun().contains(QueryClassifier.LANE_CLASSIFIER);
    }
}
