package com.bookcraft.generation.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 某模型类别当前窗口的使用情况
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitStatus {

    private String modelClass;

    private int requestsInWindow;

    private long tokensInWindow;

    private int requestLimit;

    private long tokenLimit;

    private int queuedRequests;

    /** 累计放行的请求数 */
    private long totalRequests;

    /** 累计对账后的实际 token 数 */
    private long totalTokens;
}
