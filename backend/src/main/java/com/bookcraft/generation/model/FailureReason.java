package com.bookcraft.generation.model;

public enum FailureReason {
    QUALITY_BELOW_THRESHOLD,
    GENERATION_ERROR,
    TIMEOUT,
    CONSISTENCY_CHECK_ERROR
}
