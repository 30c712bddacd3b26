package com.bookcraft.generation.orchestrator;

import com.bookcraft.generation.model.GenerationProgress;

/**
 * 进度上报
 */
@FunctionalInterface
public interface ProgressReporter {

    void report(GenerationProgress progress);
}
