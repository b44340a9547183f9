package com.stagewise.engine.api.model;

import java.util.Map;

/**
 * Input to session initialization.
 *
 * @param sessionId   caller-chosen session id; generated when null
 * @param userId      authenticated participant, may be null for anonymous runs
 * @param participant initial participant fields (demographics, panel ids)
 * @param urlParams   query parameters of the entry URL
 * @param userAgent   browser user agent, used for environment detection
 * @param screenSize  reported screen size, e.g. {@code 1920x1080}
 * @param seed        explicit randomization seed; drawn at random when null
 */
public record StartRequest(
        String sessionId,
        String userId,
        Map<String, Object> participant,
        Map<String, Object> urlParams,
        String userAgent,
        String screenSize,
        Long seed
) {
    public StartRequest {
        participant = participant == null ? Map.of() : participant;
        urlParams = urlParams == null ? Map.of() : urlParams;
    }

    public static StartRequest of(String sessionId) {
        return new StartRequest(sessionId, null, null, null, null, null, null);
    }

    public StartRequest withSeed(long newSeed) {
        return new StartRequest(sessionId, userId, participant, urlParams, userAgent, screenSize, newSeed);
    }

    public StartRequest withUrlParams(Map<String, Object> params) {
        return new StartRequest(sessionId, userId, participant, params, userAgent, screenSize, seed);
    }

    public StartRequest withParticipant(Map<String, Object> fields) {
        return new StartRequest(sessionId, userId, fields, urlParams, userAgent, screenSize, seed);
    }
}
