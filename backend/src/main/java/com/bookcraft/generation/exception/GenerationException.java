package com.bookcraft.generation.exception;

/**
 * 不可恢复的生成错误，书籍会被标记为 NEEDS_REVISION
 */
public class GenerationException extends RuntimeException {

    private final Long bookId;

    public GenerationException(String message) {
        this(null, message, null);
    }

    public GenerationException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public GenerationException(Long bookId, String message, Throwable cause) {
        super(message, cause);
        this.bookId = bookId;
    }

    public Long getBookId() {
        return bookId;
    }
}
