package com.bookcraft.generation.orchestrator;

import com.bookcraft.generation.model.GenerationProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 记录每本书最新的进度，供轮询接口查询
 */
@Component
public class ProgressTracker implements ProgressReporter {

    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

    private final Map<Long, GenerationProgress> latest = new ConcurrentHashMap<>();

    @Override
    public void report(GenerationProgress progress) {
        if (progress.getTimestamp() == null) {
            progress.setTimestamp(LocalDateTime.now());
        }
        latest.put(progress.getBookId(), progress);
        logger.info("📊 [{}] bookId={}, 阶段={}, 章节={}/{}, 进度={}%{}", progress.getStatus(), progress.getBookId(),
                progress.getStep(), progress.getCurrentChapter(), progress.getTotalChapters(),
                progress.getPercentComplete(), progress.getError() != null ? ", 错误=" + progress.getError() : "");
    }

    public Optional<GenerationProgress> getLatest(Long bookId) {
        return Optional.ofNullable(latest.get(bookId));
    }
}
