package com.bookcraft.generation.exception;

public class GenerationAlreadyRunningException extends RuntimeException {

    public GenerationAlreadyRunningException(Long bookId) {
        super("书籍 " + bookId + " 已有正在运行的生成任务");
    }
}
