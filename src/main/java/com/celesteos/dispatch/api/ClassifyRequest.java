package com.celesteos.dispatch.api;

import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/classify.
 *
 * @param query   raw user query; nullable, a missing query is classified as malformed
 * @param context opaque caller context (user, yacht, role); not used for routing
 */
public record ClassifyRequest(
    String query,
    Map<String, String> context
) {}
