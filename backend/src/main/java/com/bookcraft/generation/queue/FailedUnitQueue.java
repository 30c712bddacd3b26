package com.bookcraft.generation.queue;

import com.bookcraft.generation.exception.GenerationCancelledException;
import com.bookcraft.generation.model.FailedUnit;
import com.bookcraft.generation.model.FailureDiagnostics;
import com.bookcraft.generation.model.FailureReason;
import com.bookcraft.generation.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 失败单元队列
 *
 * 按书籍分桶，同一单元（章节号+单元号）只保留一条记录。
 * 重试次数达到上限的单元标记为永久失败，保留在列表中等待人工修订，不再自动重试。
 */
@Component
public class FailedUnitQueue {

    private static final Logger logger = LoggerFactory.getLogger(FailedUnitQueue.class);

    private static final Comparator<FailedUnit> UNIT_ORDER = Comparator.comparingInt(FailedUnit::getChapterNumber)
            .thenComparingInt(FailedUnit::getUnitNumber);

    private final Map<Long, Map<String, FailedUnit>> failedUnits = new ConcurrentHashMap<>();
    private final RetryPolicy retryPolicy;

    public FailedUnitQueue(@Qualifier("generationRetryPolicy") RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    /**
     * 记录失败单元，已存在时只刷新原因与诊断信息，重试次数不变
     */
    public FailedUnit enqueue(Long bookId, int chapterNumber, int unitNumber, FailureReason reason,
                              String reasonText, FailureDiagnostics diagnostics) {
        Map<String, FailedUnit> units = bucket(bookId);
        synchronized (units) {
            String key = chapterNumber + "-" + unitNumber;
            FailedUnit unit = units.get(key);
            if (unit == null) {
                unit = new FailedUnit(bookId, chapterNumber, unitNumber);
                units.put(key, unit);
            }
            unit.setReason(reason);
            unit.setReasonText(reasonText);
            unit.setDiagnostics(diagnostics);
            unit.setFailedAt(LocalDateTime.now());
            logger.warn("📥 单元进入失败队列: bookId={}, 第{}章第{}节, 原因={}, 已重试={}",
                    bookId, chapterNumber, unitNumber, reason, unit.getRetryCount());
            return unit.copy();
        }
    }

    /**
     * 按章节、单元顺序返回快照
     */
    public List<FailedUnit> listForBook(Long bookId) {
        Map<String, FailedUnit> units = failedUnits.get(bookId);
        List<FailedUnit> result = new ArrayList<>();
        if (units == null) {
            return result;
        }
        synchronized (units) {
            units.values().forEach(unit -> result.add(unit.copy()));
        }
        result.sort(UNIT_ORDER);
        return result;
    }

    public boolean contains(Long bookId, int chapterNumber, int unitNumber) {
        Map<String, FailedUnit> units = failedUnits.get(bookId);
        if (units == null) {
            return false;
        }
        synchronized (units) {
            return units.containsKey(chapterNumber + "-" + unitNumber);
        }
    }

    /**
     * 逐个重试可重试的单元，单元之间按退避策略等待
     */
    public RetryReport retryAll(Long bookId, int maxRetries, UnitRetryHandler handler) {
        List<FailedUnit> candidates = new ArrayList<>();
        for (FailedUnit unit : listForBook(bookId)) {
            if (unit.isPermanentlyFailed()) {
                continue;
            }
            if (unit.getRetryCount() >= maxRetries) {
                markPermanentlyFailed(bookId, unit);
                continue;
            }
            candidates.add(unit);
        }
        if (candidates.isEmpty()) {
            return new RetryReport(0, 0, 0, listForBook(bookId).size());
        }
        logger.info("🔄 开始回放失败队列: bookId={}, 待重试={}", bookId, candidates.size());

        int recovered = 0;
        int permanent = 0;
        for (int i = 0; i < candidates.size(); i++) {
            if (i > 0) {
                retryPolicy.backoff("失败队列回放", 1);
            }
            FailedUnit candidate = candidates.get(i);
            boolean done = false;
            while (!done) {
                RetryOutcome outcome;
                try {
                    outcome = handler.retry(candidate.copy());
                } catch (GenerationCancelledException e) {
                    throw e;
                } catch (RuntimeException e) {
                    outcome = RetryOutcome.failed(FailureReason.GENERATION_ERROR, e.getMessage(),
                            FailureDiagnostics.ofError(e.getMessage()));
                }
                if (outcome.isSuccess()) {
                    remove(bookId, candidate.getChapterNumber(), candidate.getUnitNumber());
                    recovered++;
                    logger.info("✅ 失败单元重试成功: bookId={}, 第{}章第{}节", bookId,
                            candidate.getChapterNumber(), candidate.getUnitNumber());
                    done = true;
                } else {
                    FailedUnit updated = recordFailure(bookId, candidate, outcome, maxRetries);
                    if (updated.isPermanentlyFailed()) {
                        permanent++;
                        done = true;
                    } else {
                        retryPolicy.backoff("第" + candidate.getChapterNumber() + "章第" + candidate.getUnitNumber() + "节重试",
                                updated.getRetryCount());
                    }
                }
            }
        }
        int remaining = listForBook(bookId).size();
        logger.info("📊 失败队列回放结束: bookId={}, 恢复={}, 转人工={}, 剩余={}", bookId, recovered, permanent, remaining);
        return new RetryReport(candidates.size(), recovered, permanent, remaining);
    }

    public void clearForBook(Long bookId) {
        Map<String, FailedUnit> removed = failedUnits.remove(bookId);
        if (removed != null && !removed.isEmpty()) {
            logger.info("🧹 已清空失败队列: bookId={}, 数量={}", bookId, removed.size());
        }
    }

    /**
     * 从检查点恢复队列内容（覆盖当前内容）
     */
    public void restore(Long bookId, List<FailedUnit> units) {
        Map<String, FailedUnit> restored = new ConcurrentHashMap<>();
        if (units != null) {
            for (FailedUnit unit : units) {
                FailedUnit copy = unit.copy();
                copy.setBookId(bookId);
                restored.put(copy.getUnitKey(), copy);
            }
        }
        failedUnits.put(bookId, restored);
    }

    public void remove(Long bookId, int chapterNumber, int unitNumber) {
        Map<String, FailedUnit> units = failedUnits.get(bookId);
        if (units != null) {
            synchronized (units) {
                units.remove(chapterNumber + "-" + unitNumber);
            }
        }
    }

    private FailedUnit recordFailure(Long bookId, FailedUnit candidate, RetryOutcome outcome, int maxRetries) {
        Map<String, FailedUnit> units = bucket(bookId);
        synchronized (units) {
            FailedUnit unit = units.computeIfAbsent(candidate.getUnitKey(), k -> candidate.copy());
            unit.setRetryCount(unit.getRetryCount() + 1);
            if (outcome.getReason() != null) {
                unit.setReason(outcome.getReason());
            }
            unit.setReasonText(outcome.getReasonText());
            unit.setDiagnostics(outcome.getDiagnostics());
            unit.setFailedAt(LocalDateTime.now());
            if (unit.getRetryCount() >= maxRetries) {
                unit.setPermanentlyFailed(true);
                logger.error("❌ 单元重试 {} 次仍失败，转人工修订: bookId={}, 第{}章第{}节", unit.getRetryCount(),
                        bookId, unit.getChapterNumber(), unit.getUnitNumber());
            } else {
                logger.warn("⚠️ 单元重试失败: bookId={}, 第{}章第{}节, 已重试={}/{}", bookId,
                        unit.getChapterNumber(), unit.getUnitNumber(), unit.getRetryCount(), maxRetries);
            }
            return unit.copy();
        }
    }

    private void markPermanentlyFailed(Long bookId, FailedUnit unit) {
        Map<String, FailedUnit> units = bucket(bookId);
        synchronized (units) {
            FailedUnit stored = units.get(unit.getUnitKey());
            if (stored != null) {
                stored.setPermanentlyFailed(true);
            }
        }
    }

    private Map<String, FailedUnit> bucket(Long bookId) {
        return failedUnits.computeIfAbsent(bookId, k -> new ConcurrentHashMap<>());
    }
}
