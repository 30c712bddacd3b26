package com.bookcraft.generation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 进度记录
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationProgress {

    private Long bookId;

    private GenerationStep step;

    private int currentChapter;

    private int totalChapters;

    private int percentComplete;

    private ProgressStatus status;

    private String message;

    private String error;

    private LocalDateTime timestamp;
}
