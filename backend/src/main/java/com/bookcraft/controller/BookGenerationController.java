package com.bookcraft.controller;

import com.bookcraft.common.Result;
import com.bookcraft.generation.checkpoint.CheckpointSummary;
import com.bookcraft.generation.model.FailedUnit;
import com.bookcraft.generation.model.GenerationProgress;
import com.bookcraft.service.BookGenerationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 书籍生成Controller
 */
@RestController
@RequestMapping("/books")
@CrossOrigin(originPatterns = {"http://localhost:*", "http://127.0.0.1:*"}, allowCredentials = "true")
public class BookGenerationController {

    private static final Logger logger = LoggerFactory.getLogger(BookGenerationController.class);

    @Autowired
    private BookGenerationService generationService;

    /**
     * 启动生成，存在检查点时自动续写
     */
    @PostMapping("/{id}/generate")
    public Result<Map<String, Object>> startGeneration(@PathVariable Long id) {
        boolean resumed = generationService.startGeneration(id);
        Map<String, Object> data = new HashMap<>();
        data.put("bookId", id);
        data.put("resumed", resumed);
        logger.info("📚 收到生成请求: bookId={}, 续写={}", id, resumed);
        return Result.success(resumed ? "已从检查点续写" : "已开始生成", data);
    }

    @PostMapping("/{id}/cancel")
    public Result<String> cancelGeneration(@PathVariable Long id) {
        if (!generationService.cancelGeneration(id)) {
            return Result.error("该书没有正在进行的生成任务");
        }
        return Result.success("已请求暂停，将在当前批次结束后生效");
    }

    @GetMapping("/{id}/progress")
    public Result<GenerationProgress> getProgress(@PathVariable Long id) {
        Optional<GenerationProgress> progress = generationService.getProgress(id);
        if (!progress.isPresent()) {
            return Result.error(404, "暂无生成进度");
        }
        return Result.success(progress.get());
    }

    /**
     * 失败队列，包括已转人工修订的单元
     */
    @GetMapping("/{id}/failed-units")
    public Result<List<FailedUnit>> getFailedUnits(@PathVariable Long id) {
        return Result.success(generationService.getFailedUnits(id));
    }

    @GetMapping("/{id}/checkpoint")
    public Result<CheckpointSummary> getCheckpoint(@PathVariable Long id) {
        Optional<CheckpointSummary> summary = generationService.getCheckpointSummary(id);
        if (!summary.isPresent()) {
            return Result.error(404, "没有检查点");
        }
        return Result.success(summary.get());
    }
}
