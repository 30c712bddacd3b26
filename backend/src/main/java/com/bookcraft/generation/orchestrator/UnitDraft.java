package com.bookcraft.generation.orchestrator;

import com.bookcraft.generation.ai.TextGenerationException;
import com.bookcraft.generation.scene.UnitWritingRequest;
import lombok.Getter;

/**
 * 单元初稿：正文或生成失败原因二选一
 */
@Getter
public final class UnitDraft {

    private final UnitWritingRequest request;
    private final String content;
    private final TextGenerationException failure;

    private UnitDraft(UnitWritingRequest request, String content, TextGenerationException failure) {
        this.request = request;
        this.content = content;
        this.failure = failure;
    }

    public static UnitDraft of(UnitWritingRequest request, String content) {
        return new UnitDraft(request, content, null);
    }

    public static UnitDraft failed(UnitWritingRequest request, TextGenerationException failure) {
        return new UnitDraft(request, null, failure);
    }

    public boolean isFailed() {
        return failure != null;
    }
}
