package com.bookcraft.generation.exception;

/**
 * 生成被取消（或线程被中断），在下一个单元边界处抛出
 */
public class GenerationCancelledException extends RuntimeException {

    public GenerationCancelledException(String message) {
        super(message);
    }

    public GenerationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
