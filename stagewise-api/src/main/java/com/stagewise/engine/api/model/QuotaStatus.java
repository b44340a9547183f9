package com.stagewise.engine.api.model;

/**
 * Capacity snapshot of one branch.
 *
 * @param limit     configured cap
 * @param completed permanently consumed slots
 * @param reserved  live holds
 * @param available {@code max(0, limit - completed - reserved)}
 * @param full      {@code completed >= limit}
 */
public record QuotaStatus(long limit, long completed, long reserved, long available, boolean full) {

    public static QuotaStatus of(long limit, long completed, long reserved) {
        return new QuotaStatus(limit, completed, reserved,
                Math.max(0, limit - completed - reserved), completed >= limit);
    }
}
