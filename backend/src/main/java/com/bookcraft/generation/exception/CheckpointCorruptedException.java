package com.bookcraft.generation.exception;

/**
 * 检查点文件存在但无法读取或版本不符，不会自动从头重来
 */
public class CheckpointCorruptedException extends CheckpointStoreException {

    public CheckpointCorruptedException(String message) {
        super(message);
    }

    public CheckpointCorruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
