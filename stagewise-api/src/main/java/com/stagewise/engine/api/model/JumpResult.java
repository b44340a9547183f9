package com.stagewise.engine.api.model;

import java.util.List;

/**
 * Result of a jump.
 *
 * @param state              persisted session state after the jump
 * @param currentUnitId      the jump target
 * @param returnUnitId       unit the participant left, used by resume
 * @param invalidatedUnitIds completed units demoted by the invalidation cascade
 */
public record JumpResult(
        SessionState state,
        String currentUnitId,
        String returnUnitId,
        List<String> invalidatedUnitIds
) {
}
