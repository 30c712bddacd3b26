package com.bookcraft.config;

import com.bookcraft.common.Result;
import com.bookcraft.generation.exception.CheckpointCorruptedException;
import com.bookcraft.generation.exception.CheckpointStoreException;
import com.bookcraft.generation.exception.GenerationAlreadyRunningException;
import com.bookcraft.generation.exception.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 全局异常处理器
 * 统一处理系统异常并返回 Result 格式的错误响应
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 同一本书重复启动
     */
    @ExceptionHandler(GenerationAlreadyRunningException.class)
    public ResponseEntity<Result<Void>> handleAlreadyRunning(GenerationAlreadyRunningException e) {
        logger.warn("重复启动: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Result.error(HttpStatus.CONFLICT.value(), e.getMessage()));
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<Result<Void>> handleGenerationException(GenerationException e) {
        logger.warn("生成请求失败: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Result.error(HttpStatus.BAD_REQUEST.value(), e.getMessage()));
    }

    /**
     * 检查点损坏需要人工处理，不会自动删除
     */
    @ExceptionHandler(CheckpointCorruptedException.class)
    public ResponseEntity<Result<Void>> handleCheckpointCorrupted(CheckpointCorruptedException e) {
        logger.error("检查点损坏: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Result.error(HttpStatus.CONFLICT.value(), "检查点已损坏，请人工处理: " + e.getMessage()));
    }

    @ExceptionHandler(CheckpointStoreException.class)
    public ResponseEntity<Result<Void>> handleCheckpointStore(CheckpointStoreException e) {
        logger.error("检查点读写失败: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), "检查点读写失败，请稍后重试"));
    }

    /**
     * 处理参数类型错误异常
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Result<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        logger.warn("参数类型错误: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.error(HttpStatus.BAD_REQUEST.value(), "参数 " + e.getName() + " 类型不正确"));
    }

    /**
     * 处理数据库操作异常
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Result<Void>> handleDataAccessException(DataAccessException e) {
        logger.error("数据库操作异常: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), "数据操作失败，请稍后重试"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleGeneralException(Exception e) {
        logger.error("系统异常: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.error(HttpStatus.INTERNAL_SERVER_ERROR.value(), "系统内部错误，请联系管理员"));
    }
}
