package org.carball.sqlinspector.inspector;

import org.carball.sqlinspector.model.query.AggregationResult;

/**
 * The outcome of inspecting one request: its aggregation and the cache key it was stored under.
 */
public record InspectionSnapshot(String key, AggregationResult result) {
}
