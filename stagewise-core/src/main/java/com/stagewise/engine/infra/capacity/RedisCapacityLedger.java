/*
 * Copyright (c) 2025 Stagewise Navigation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.stagewise.engine.infra.capacity;

import com.stagewise.engine.api.exceptions.StoreUnavailableException;
import com.stagewise.engine.api.model.QuotaStatus;
import com.stagewise.engine.api.store.BranchKey;
import com.stagewise.engine.api.store.CapacityLedger;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Capacity ledger shared through Redis.
 *
 * <p>Keys per branch:
 * <ul>
 *   <li>{@code quota:{exp:dp:branch}} - permanent completion counter</li>
 *   <li>{@code quota:{exp:dp:branch}:reserved:<session>} - hold with TTL</li>
 * </ul>
 * The branch part is a hash tag, so both keys of a branch land in the same
 * cluster slot and each Lua script touches a single slot.
 *
 * <p>Check-and-hold and complete-and-release each run as one Lua script, so
 * concurrent participants on different instances never race between the
 * check and the write.
 */
public class RedisCapacityLedger implements CapacityLedger {

    private static final Logger logger = Logger.getLogger(RedisCapacityLedger.class.getName());

    static final String RESERVE_SCRIPT = """
            if redis.call('exists', KEYS[2]) == 1 then
              return 1
            end
            local completed = tonumber(redis.call('get', KEYS[1]) or '0')
            if completed >= tonumber(ARGV[1]) then
              return 0
            end
            redis.call('set', KEYS[2], '1', 'EX', ARGV[2])
            return 1
            """;

    static final String COMPLETE_SCRIPT = """
            local completed = redis.call('incr', KEYS[1])
            redis.call('del', KEYS[2])
            return completed
            """;

    private final RedissonClient redisson;

    public RedisCapacityLedger(RedissonClient redisson) {
        this.redisson = redisson;
        logger.info("RedisCapacityLedger initialized");
    }

    @Override
    public boolean tryReserve(BranchKey key, String sessionId, long limit, Duration holdTtl) {
        try {
            Long reserved = script().eval(RScript.Mode.READ_WRITE, RESERVE_SCRIPT, RScript.ReturnType.INTEGER,
                    List.<Object>of(counterKey(key), holdKey(key, sessionId)),
                    String.valueOf(limit), String.valueOf(Math.max(1, holdTtl.getSeconds())));
            return reserved != null && reserved == 1L;
        } catch (RedisException e) {
            throw failure("Failed to reserve capacity on " + key, e);
        }
    }

    @Override
    public long tryComplete(BranchKey key, String sessionId) {
        try {
            Long completed = script().eval(RScript.Mode.READ_WRITE, COMPLETE_SCRIPT, RScript.ReturnType.INTEGER,
                    List.<Object>of(counterKey(key), holdKey(key, sessionId)));
            return completed == null ? 0 : completed;
        } catch (RedisException e) {
            throw failure("Failed to complete capacity on " + key, e);
        }
    }

    @Override
    public void release(BranchKey key, String sessionId) {
        try {
            redisson.getBucket(holdKey(key, sessionId), StringCodec.INSTANCE).delete();
        } catch (RedisException e) {
            throw failure("Failed to release hold of " + sessionId + " on " + key, e);
        }
    }

    @Override
    public boolean holds(BranchKey key, String sessionId) {
        try {
            return redisson.getBucket(holdKey(key, sessionId), StringCodec.INSTANCE).isExists();
        } catch (RedisException e) {
            throw failure("Failed to read hold of " + sessionId + " on " + key, e);
        }
    }

    @Override
    public QuotaStatus status(BranchKey key, long limit) {
        try {
            Object raw = redisson.getBucket(counterKey(key), StringCodec.INSTANCE).get();
            long completed = raw == null ? 0 : Long.parseLong(raw.toString());
            long reserved = redisson.getKeys().getKeysStreamByPattern(holdPattern(key)).count();
            return QuotaStatus.of(limit, completed, reserved);
        } catch (RedisException e) {
            throw failure("Failed to read capacity of " + key, e);
        }
    }

    @Override
    public void reset(BranchKey key) {
        try {
            redisson.getKeys().deleteByPattern(holdPattern(key));
            redisson.getKeys().delete(counterKey(key));
        } catch (RedisException e) {
            throw failure("Failed to reset capacity of " + key, e);
        }
    }

    private RScript script() {
        return redisson.getScript(StringCodec.INSTANCE);
    }

    static String counterKey(BranchKey key) {
        return "quota:{" + key + "}";
    }

    static String holdKey(BranchKey key, String sessionId) {
        return counterKey(key) + ":reserved:" + sessionId;
    }

    private static String holdPattern(BranchKey key) {
        return counterKey(key) + ":reserved:*";
    }

    private static StoreUnavailableException failure(String message, RedisException e) {
        logger.log(Level.SEVERE, message, e);
        return new StoreUnavailableException(message, e);
    }
}
