package com.bookcraft.generation.ratelimit;

/**
 * 排队优先级，声明顺序即出队顺序
 */
public enum RequestPriority {
    HIGH,
    NORMAL,
    LOW
}
