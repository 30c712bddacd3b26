package com.bookcraft.generation.queue;

import com.bookcraft.generation.model.FailedUnit;

/**
 * 重新跑一遍单元的完整生成周期
 */
@FunctionalInterface
public interface UnitRetryHandler {

    RetryOutcome retry(FailedUnit unit);
}
