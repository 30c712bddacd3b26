package com.bookcraft.service;

import com.bookcraft.domain.entity.Book;
import com.bookcraft.generation.checkpoint.CheckpointStore;
import com.bookcraft.generation.checkpoint.CheckpointSummary;
import com.bookcraft.generation.exception.GenerationAlreadyRunningException;
import com.bookcraft.generation.exception.GenerationCancelledException;
import com.bookcraft.generation.exception.GenerationException;
import com.bookcraft.generation.model.FailedUnit;
import com.bookcraft.generation.model.GenerationProgress;
import com.bookcraft.generation.orchestrator.BookGenerationOrchestrator;
import com.bookcraft.generation.orchestrator.ProgressTracker;
import com.bookcraft.generation.queue.FailedUnitQueue;
import com.bookcraft.generation.store.BookStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * 书籍生成服务
 *
 * 每本书同时只允许一条流水线，流水线在 bookGenerationExecutor 上异步运行。
 */
@Service
public class BookGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(BookGenerationService.class);

    private final BookGenerationOrchestrator orchestrator;
    private final BookStore bookStore;
    private final ProgressTracker progressTracker;
    private final FailedUnitQueue failedUnitQueue;
    private final CheckpointStore checkpointStore;
    private final AsyncTaskExecutor executor;

    private final Map<Long, Future<?>> running = new ConcurrentHashMap<>();

    public BookGenerationService(BookGenerationOrchestrator orchestrator,
                                 BookStore bookStore,
                                 ProgressTracker progressTracker,
                                 FailedUnitQueue failedUnitQueue,
                                 CheckpointStore checkpointStore,
                                 @Qualifier("bookGenerationExecutor") AsyncTaskExecutor executor) {
        this.orchestrator = orchestrator;
        this.bookStore = bookStore;
        this.progressTracker = progressTracker;
        this.failedUnitQueue = failedUnitQueue;
        this.checkpointStore = checkpointStore;
        this.executor = executor;
    }

    /**
     * 启动（或从检查点续写）一本书的生成
     *
     * @return 是否为续写
     * @throws GenerationAlreadyRunningException 该书已有运行中的流水线
     */
    public boolean startGeneration(Long bookId) {
        Book book = bookStore.findBook(bookId);
        if (book == null) {
            throw new GenerationException(bookId, "书籍不存在: " + bookId, null);
        }
        if (book.getStatus() == Book.BookStatus.COMPLETE) {
            throw new GenerationException(bookId, "书籍已生成完成: " + bookId, null);
        }
        boolean resume = checkpointStore.exists(bookId);
        synchronized (running) {
            Future<?> existing = running.get(bookId);
            if (existing != null && !existing.isDone()) {
                throw new GenerationAlreadyRunningException(bookId);
            }
            running.put(bookId, executor.submit(() -> runPipeline(bookId)));
        }
        logger.info("🚀 已提交书籍生成任务: bookId={}, 续写={}", bookId, resume);
        return resume;
    }

    /**
     * 请求取消，流水线在下一个批次边界暂停
     */
    public boolean cancelGeneration(Long bookId) {
        Future<?> future = running.get(bookId);
        if (future == null || future.isDone()) {
            return false;
        }
        if (!orchestrator.cancel(bookId)) {
            // 任务还在排队，尚未开始
            future.cancel(false);
            running.remove(bookId, future);
        }
        return true;
    }

    public boolean isRunning(Long bookId) {
        Future<?> future = running.get(bookId);
        return future != null && !future.isDone();
    }

    public Optional<GenerationProgress> getProgress(Long bookId) {
        return progressTracker.getLatest(bookId);
    }

    public List<FailedUnit> getFailedUnits(Long bookId) {
        return failedUnitQueue.listForBook(bookId);
    }

    public Optional<CheckpointSummary> getCheckpointSummary(Long bookId) {
        return checkpointStore.summary(bookId);
    }

    private void runPipeline(Long bookId) {
        try {
            orchestrator.generate(bookId);
        } catch (GenerationCancelledException e) {
            logger.info("⏸️ 书籍生成已暂停，可从检查点续写: bookId={}", bookId);
        } catch (GenerationException e) {
            logger.error("❌ 书籍生成任务结束于错误: bookId={}, 原因={}", bookId, e.getMessage());
        } finally {
            synchronized (running) {
                running.remove(bookId);
            }
        }
    }
}
