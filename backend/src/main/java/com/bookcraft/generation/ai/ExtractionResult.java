package com.bookcraft.generation.ai;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 结构化抽取结果
 *
 * SUCCESS：原文直接通过严格解析与校验；PARTIAL：经过结构清洗（去代码块、截取 JSON 主体）后才解析成功；
 * FAILED：所有解析与追加提示都失败，value 为 null。
 */
@Getter
public final class ExtractionResult<T> {

    public enum Status {
        SUCCESS,
        PARTIAL,
        FAILED
    }

    private final Status status;
    private final T value;
    private final List<String> errors;
    private final int attempts;

    private ExtractionResult(Status status, T value, List<String> errors, int attempts) {
        this.status = status;
        this.value = value;
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
        this.attempts = attempts;
    }

    public static <T> ExtractionResult<T> success(T value) {
        return new ExtractionResult<>(Status.SUCCESS, value, Collections.emptyList(), 1);
    }

    public static <T> ExtractionResult<T> partial(T value, List<String> notes) {
        return new ExtractionResult<>(Status.PARTIAL, value, notes, 1);
    }

    public static <T> ExtractionResult<T> failed(List<String> errors) {
        return new ExtractionResult<>(Status.FAILED, null, errors, 1);
    }

    ExtractionResult<T> withAttempts(int attempts, List<String> earlierErrors) {
        List<String> merged = new ArrayList<>(earlierErrors);
        merged.addAll(errors);
        return new ExtractionResult<>(status, value, merged, attempts);
    }

    public boolean isUsable() {
        return status != Status.FAILED;
    }
}
