package com.stagewise.engine.evaluator;

import com.stagewise.engine.api.model.ParticipantContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only variables a visibility rule is evaluated against.
 *
 * @param participant  demographics and identity fields
 * @param responses    submitted payloads keyed by unit id
 * @param scores       computed scores
 * @param assignments  committed decision-point assignments
 * @param urlParams    query parameters the session was started with
 * @param environment  detected device, browser and screen
 */
public record EvaluationContext(
        Map<String, Object> participant,
        Map<String, Object> responses,
        Map<String, Object> scores,
        Map<String, Object> assignments,
        Map<String, Object> urlParams,
        Map<String, Object> environment
) {
    private static final EvaluationContext EMPTY = new EvaluationContext(null, null, null, null, null, null);

    public EvaluationContext {
        participant = frozen(participant);
        responses = frozen(responses);
        scores = frozen(scores);
        assignments = frozen(assignments);
        urlParams = frozen(urlParams);
        environment = frozen(environment);
    }

    public static EvaluationContext empty() {
        return EMPTY;
    }

    /**
     * Context of a session: the participant's accumulated variables plus the
     * assignments committed so far.
     */
    public static EvaluationContext of(ParticipantContext context, Map<String, String> assignments) {
        return new EvaluationContext(context.participant(), context.responses(), context.scores(),
                new LinkedHashMap<>(assignments), context.urlParams(), context.environment());
    }

    public EvaluationContext withResponses(Map<String, Object> newResponses) {
        return new EvaluationContext(participant, newResponses, scores, assignments, urlParams, environment);
    }

    private static Map<String, Object> frozen(Map<String, ?> source) {
        return source == null || source.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
