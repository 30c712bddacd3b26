package com.bookcraft.generation.quality;

public enum QualityDecision {
    /** 直接接收 */
    ACCEPT,
    /** 分数较高，润色后接收 */
    POLISH,
    /** 低于门槛，进入失败队列 */
    REJECT
}
