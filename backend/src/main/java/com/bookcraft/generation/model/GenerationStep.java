package com.bookcraft.generation.model;

/**
 * 生成流水线阶段
 */
public enum GenerationStep {

    PREMISE,
    OUTLINE,
    CHAPTERS,
    SUPERVISION,
    COMPLETE,
    ERROR;

    /**
     * 只允许按顺序推进到下一阶段，或从任意未结束阶段进入 ERROR
     */
    public boolean canTransitionTo(GenerationStep next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == ERROR) {
            return true;
        }
        return next.ordinal() == this.ordinal() + 1;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
