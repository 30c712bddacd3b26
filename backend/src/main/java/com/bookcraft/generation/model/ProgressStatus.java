package com.bookcraft.generation.model;

public enum ProgressStatus {
    IN_PROGRESS,
    COMPLETED,
    PAUSED,
    ERROR
}
