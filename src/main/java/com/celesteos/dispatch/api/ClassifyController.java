package com.celesteos.dispatch.api;

import com.celesteos.core.engine.RoutingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for query routing.
 */
@RestController
@RequestMapping("/api/v1/classify")
public class ClassifyController {

    private final RoutingService routingService;

    public ClassifyController(RoutingService routingService) {
        this.routingService = routingService;
    }

    /**
     * POST /api/v1/classify — Route one query. Always 200: malformed and hostile
     * queries come back as UNKNOWN or BLOCKED, not as HTTP errors.
     */
    @PostMapping
    public ResponseEntity<ClassifyResponse> classify(@RequestBody(required = false) ClassifyRequest request) {
        String query = request != null ? request.query() : null;
        var context = request != null ? request.context() : null;
        return ResponseEntity.ok(ClassifyResponse.from(routingService.route(query, context)));
    }
}
