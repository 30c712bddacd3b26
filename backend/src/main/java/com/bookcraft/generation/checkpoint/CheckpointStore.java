package com.bookcraft.generation.checkpoint;

import com.bookcraft.generation.model.GenerationCheckpoint;

import java.util.Optional;

/**
 * 检查点持久化
 */
public interface CheckpointStore {

    void save(GenerationCheckpoint checkpoint);

    /**
     * 不存在时返回 empty；存在但无法读取时抛出 CheckpointCorruptedException
     */
    Optional<GenerationCheckpoint> load(Long bookId);

    void clear(Long bookId);

    boolean exists(Long bookId);

    default Optional<CheckpointSummary> summary(Long bookId) {
        return load(bookId).map(CheckpointSummary::of);
    }
}
