package com.bookcraft.generation.ratelimit;

import lombok.Getter;

import java.time.Instant;

/**
 * 限流许可：对应窗口内的一条预留记录，调用结束后用实际用量对账
 */
@Getter
public class RateLimitPermit {

    private final long id;
    private final String modelClass;
    private final long estimatedTokens;
    private final RequestPriority priority;
    private final Instant grantedAt;

    RateLimitPermit(long id, String modelClass, long estimatedTokens, RequestPriority priority, Instant grantedAt) {
        this.id = id;
        this.modelClass = modelClass;
        this.estimatedTokens = estimatedTokens;
        this.priority = priority;
        this.grantedAt = grantedAt;
    }

    @Override
    public String toString() {
        return "RateLimitPermit{" + modelClass + "#" + id + ", est=" + estimatedTokens + "}";
    }
}
