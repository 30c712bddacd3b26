package com.bookcraft.generation.ai;

/**
 * 文本生成调用失败
 */
public class TextGenerationException extends RuntimeException {

    private final boolean transientFailure;
    private final boolean timeout;

    public TextGenerationException(String message, boolean transientFailure) {
        this(message, transientFailure, false, null);
    }

    public TextGenerationException(String message, boolean transientFailure, Throwable cause) {
        this(message, transientFailure, false, cause);
    }

    private TextGenerationException(String message, boolean transientFailure, boolean timeout, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.timeout = timeout;
    }

    public static TextGenerationException timeout(String message, Throwable cause) {
        return new TextGenerationException(message, true, true, cause);
    }

    public static TextGenerationException fatal(String message) {
        return new TextGenerationException(message, false);
    }

    /** 限流、5xx、网络与超时为瞬时错误 */
    public boolean isTransient() {
        return transientFailure;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
