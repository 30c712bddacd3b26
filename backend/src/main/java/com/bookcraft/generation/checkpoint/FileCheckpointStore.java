package com.bookcraft.generation.checkpoint;

import com.bookcraft.generation.exception.CheckpointCorruptedException;
import com.bookcraft.generation.exception.CheckpointStoreException;
import com.bookcraft.generation.model.GenerationCheckpoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * 基于文件的检查点存储：{@code <dir>/<bookId>-checkpoint.json}
 *
 * 先写临时文件再原子替换，进程在写入中途退出不会留下半个文件。
 */
@Component
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger logger = LoggerFactory.getLogger(FileCheckpointStore.class);

    static final String FILE_SUFFIX = "-checkpoint.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Value("${bookcraft.checkpoint.retention-days:30}")
    private int retentionDays = 30;

    @Autowired
    public FileCheckpointStore(@Value("${bookcraft.checkpoint.directory:checkpoints}") String directory,
                               ObjectMapper objectMapper) {
        this(Paths.get(directory), objectMapper);
    }

    public FileCheckpointStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void save(GenerationCheckpoint checkpoint) {
        if (checkpoint.getBookId() == null) {
            throw new CheckpointStoreException("检查点缺少 bookId");
        }
        Path target = pathFor(checkpoint.getBookId());
        Path temp = directory.resolve(checkpoint.getBookId() + FILE_SUFFIX + ".tmp");
        try {
            Files.createDirectories(directory);
            byte[] json = objectMapper.writeValueAsBytes(checkpoint);
            Files.write(temp, json);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            logger.debug("💾 检查点已保存: bookId={}, 已完成章节={}", checkpoint.getBookId(),
                    checkpoint.getCompletedChapters());
        } catch (IOException e) {
            throw new CheckpointStoreException("保存检查点失败: bookId=" + checkpoint.getBookId(), e);
        }
    }

    @Override
    public Optional<GenerationCheckpoint> load(Long bookId) {
        Path file = pathFor(bookId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        GenerationCheckpoint checkpoint;
        try {
            String json = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            checkpoint = objectMapper.readValue(json, GenerationCheckpoint.class);
        } catch (JsonProcessingException e) {
            throw new CheckpointCorruptedException("检查点文件无法解析: " + file, e);
        } catch (IOException e) {
            throw new CheckpointStoreException("读取检查点失败: " + file, e);
        }
        if (checkpoint == null) {
            throw new CheckpointCorruptedException("检查点文件为空: " + file);
        }
        if (!GenerationCheckpoint.CURRENT_VERSION.equals(checkpoint.getVersion())) {
            throw new CheckpointCorruptedException("检查点版本不兼容: " + checkpoint.getVersion() + ", 期望 "
                    + GenerationCheckpoint.CURRENT_VERSION);
        }
        if (!bookId.equals(checkpoint.getBookId())) {
            throw new CheckpointCorruptedException("检查点 bookId 不匹配: 文件=" + checkpoint.getBookId() + ", 期望=" + bookId);
        }
        return Optional.of(checkpoint);
    }

    @Override
    public void clear(Long bookId) {
        try {
            if (Files.deleteIfExists(pathFor(bookId))) {
                logger.info("🧹 检查点已清除: bookId={}", bookId);
            }
        } catch (IOException e) {
            throw new CheckpointStoreException("清除检查点失败: bookId=" + bookId, e);
        }
    }

    @Override
    public boolean exists(Long bookId) {
        return Files.exists(pathFor(bookId));
    }

    /**
     * 删除超过保留天数的检查点文件
     *
     * @return 删除的文件数
     */
    public int cleanupOlderThan(int days) {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(days, ChronoUnit.DAYS);
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new CheckpointStoreException("清理过期检查点失败: " + directory, e);
        }
        if (removed > 0) {
            logger.info("🧹 已清理 {} 个超过 {} 天的检查点", removed, days);
        }
        return removed;
    }

    @Scheduled(cron = "${bookcraft.checkpoint.cleanup-cron:0 30 3 * * ?}")
    public void scheduledCleanup() {
        try {
            cleanupOlderThan(retentionDays);
        } catch (CheckpointStoreException e) {
            logger.error("❌ 定时清理检查点失败: {}", e.getMessage(), e);
        }
    }

    Path pathFor(Long bookId) {
        return directory.resolve(bookId + FILE_SUFFIX);
    }
}
