package com.bookcraft.generation.orchestrator;

import com.bookcraft.config.GenerationProperties;
import com.bookcraft.domain.entity.Book;
import com.bookcraft.domain.entity.Chapter;
import com.bookcraft.domain.entity.GenerationUnit;
import com.bookcraft.generation.ai.TextGenerationException;
import com.bookcraft.generation.checkpoint.CheckpointStore;
import com.bookcraft.generation.continuity.ContinuityTracker;
import com.bookcraft.generation.exception.GenerationCancelledException;
import com.bookcraft.generation.exception.GenerationException;
import com.bookcraft.generation.model.CharacterState;
import com.bookcraft.generation.model.FailedUnit;
import com.bookcraft.generation.model.GenerationCheckpoint;
import com.bookcraft.generation.model.GenerationProgress;
import com.bookcraft.generation.model.GenerationStep;
import com.bookcraft.generation.model.ProgressStatus;
import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.UnitPlan;
import com.bookcraft.generation.quality.SupervisionResult;
import com.bookcraft.generation.quality.SupervisionReviewer;
import com.bookcraft.generation.queue.FailedUnitQueue;
import com.bookcraft.generation.queue.RetryOutcome;
import com.bookcraft.generation.queue.RetryReport;
import com.bookcraft.generation.ratelimit.RequestPriority;
import com.bookcraft.generation.scene.SceneContext;
import com.bookcraft.generation.scene.SceneContextFactory;
import com.bookcraft.generation.scene.UnitWritingRequest;
import com.bookcraft.generation.session.GenerationSession;
import com.bookcraft.generation.store.BookStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 整本书的生成编排
 *
 * PREMISE → OUTLINE → CHAPTERS → SUPERVISION → COMPLETE，任何阶段出现不可恢复错误进入 ERROR。
 * 进入时先检查检查点：存在则恢复叙事状态与失败队列，从第一个未完成章节继续，已完成单元不会重写。
 * 检查点在大纲完成后、每个批次后、每章完成后、失败队列回放后以及标记完成前保存，完成后清除。
 */
@Service
public class BookGenerationOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(BookGenerationOrchestrator.class);

    private static final int PREVIOUS_EXCERPT_CHARS = 300;

    private final BookStore store;
    private final CheckpointStore checkpointStore;
    private final FailedUnitQueue failedUnitQueue;
    private final ContinuityTracker continuityTracker;
    private final StoryPlanner storyPlanner;
    private final ChapterPlanner chapterPlanner;
    private final SceneContextFactory sceneContextFactory;
    private final UnitCycleRunner unitCycleRunner;
    private final SupervisionReviewer supervisionReviewer;
    private final ProgressReporter progressReporter;
    private final GenerationProperties properties;
    private final ObjectMapper objectMapper;
    private final Executor unitExecutor;

    private final Map<Long, AtomicBoolean> cancelFlags = new ConcurrentHashMap<>();

    public BookGenerationOrchestrator(BookStore store,
                                      CheckpointStore checkpointStore,
                                      FailedUnitQueue failedUnitQueue,
                                      ContinuityTracker continuityTracker,
                                      StoryPlanner storyPlanner,
                                      ChapterPlanner chapterPlanner,
                                      SceneContextFactory sceneContextFactory,
                                      UnitCycleRunner unitCycleRunner,
                                      SupervisionReviewer supervisionReviewer,
                                      ProgressReporter progressReporter,
                                      GenerationProperties properties,
                                      ObjectMapper objectMapper,
                                      @Qualifier("unitGenerationExecutor") Executor unitExecutor) {
        this.store = store;
        this.checkpointStore = checkpointStore;
        this.failedUnitQueue = failedUnitQueue;
        this.continuityTracker = continuityTracker;
        this.storyPlanner = storyPlanner;
        this.chapterPlanner = chapterPlanner;
        this.sceneContextFactory = sceneContextFactory;
        this.unitCycleRunner = unitCycleRunner;
        this.supervisionReviewer = supervisionReviewer;
        this.progressReporter = progressReporter;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.unitExecutor = unitExecutor;
    }

    /**
     * 生成（或续写）一本书
     *
     * @throws GenerationException 不可恢复的错误，书籍已标记为 NEEDS_REVISION
     * @throws GenerationCancelledException 被取消，书籍已标记为 PAUSED，最近一次检查点保留
     */
    public void generate(Long bookId) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        cancelFlags.put(bookId, cancelled);
        GenerationStep step = GenerationStep.PREMISE;
        int totalChapters = 0;
        try {
            Book book = store.findBook(bookId);
            if (book == null) {
                throw new GenerationException(bookId, "书籍不存在: " + bookId, null);
            }
            totalChapters = book.getChapterCount() != null ? book.getChapterCount() : 0;

            Optional<GenerationCheckpoint> checkpoint = checkpointStore.load(bookId);
            GenerationSession session;
            StoryBible bible;
            String premise;
            if (checkpoint.isPresent()) {
                session = GenerationSession.fromCheckpoint(checkpoint.get());
                failedUnitQueue.restore(bookId, checkpoint.get().getFailedUnits());
                bible = readStoryBible(book);
                premise = book.getPremise();
                step = GenerationStep.CHAPTERS;
                logger.info("♻️ 从检查点恢复: bookId={}, 已完成章节={}, 失败单元={}", bookId,
                        session.getCompletedChapters(), checkpoint.get().getFailedUnits().size());
                store.updateBookState(bookId, Book.BookStatus.GENERATING, step, null);
            } else {
                failedUnitQueue.clearForBook(bookId);
                session = GenerationSession.start(bookId);
                store.updateBookState(bookId, Book.BookStatus.GENERATING, step, null);
                report(bookId, step, 0, totalChapters, 10, ProgressStatus.IN_PROGRESS, "生成故事前提", null);
                premise = storyPlanner.generatePremise(book);
                store.savePremise(bookId, premise);
                report(bookId, step, 0, totalChapters, 25, ProgressStatus.IN_PROGRESS, "故事前提已完成", null);

                step = advance(bookId, step, GenerationStep.OUTLINE);
                bible = storyPlanner.generateStoryBible(book, premise);
                store.saveStoryBible(bookId, writeStoryBible(bible));
                store.replaceChapters(bookId, planChapters(book, bible));
                continuityTracker.initialize(session, bible.getCharacters(), bible, bible.getResearchFacts());
                saveCheckpoint(session);
                report(bookId, step, 0, totalChapters, 40, ProgressStatus.IN_PROGRESS, "故事圣经已完成", null);

                step = advance(bookId, step, GenerationStep.CHAPTERS);
            }

            List<Chapter> chapters = store.listChapters(bookId);
            chapters.sort(Comparator.comparing(Chapter::getChapterNumber));
            totalChapters = chapters.size();
            for (Chapter chapter : chapters) {
                int chapterNumber = chapter.getChapterNumber();
                if (session.isChapterComplete(chapterNumber)) {
                    continue;
                }
                checkCancelled(bookId, cancelled);
                generateChapter(session, book, premise, bible, chapter, cancelled);
                int done = session.getCompletedChapters().size();
                report(bookId, step, chapterNumber, totalChapters, 50 + 40 * done / Math.max(1, totalChapters),
                        ProgressStatus.IN_PROGRESS, "第" + chapterNumber + "章完成", null);
            }

            checkCancelled(bookId, cancelled);
            drainFailedUnits(session, book, premise, bible, chapters);

            step = advance(bookId, step, GenerationStep.SUPERVISION);
            report(bookId, step, totalChapters, totalChapters, 95, ProgressStatus.IN_PROGRESS, "全书审校", null);
            superviseChapters(bookId, chapters);

            saveCheckpoint(session);
            step = advance(bookId, step, GenerationStep.COMPLETE);
            store.updateBookState(bookId, Book.BookStatus.COMPLETE, step, null);
            checkpointStore.clear(bookId);
            report(bookId, step, totalChapters, totalChapters, 100, ProgressStatus.COMPLETED, "生成完成", null);
            logger.info("🎉 书籍生成完成: bookId={}, 待人工修订单元={}", bookId, failedUnitQueue.listForBook(bookId).size());
        } catch (GenerationCancelledException e) {
            logger.warn("⏸️ 书籍生成已暂停: bookId={}, 阶段={}", bookId, step);
            markQuietly(bookId, Book.BookStatus.PAUSED, step, null);
            report(bookId, step, 0, totalChapters, 0, ProgressStatus.PAUSED, "已暂停", null);
            throw e;
        } catch (RuntimeException e) {
            logger.error("❌ 书籍生成失败: bookId={}, 阶段={}, 原因={}", bookId, step, e.getMessage(), e);
            markQuietly(bookId, Book.BookStatus.NEEDS_REVISION, GenerationStep.ERROR, e.getMessage());
            report(bookId, GenerationStep.ERROR, 0, totalChapters, 0, ProgressStatus.ERROR, "生成失败", e.getMessage());
            if (e instanceof GenerationException) {
                throw e;
            }
            throw new GenerationException(bookId, "书籍生成失败: " + e.getMessage(), e);
        } finally {
            cancelFlags.remove(bookId, cancelled);
        }
    }

    /**
     * 请求取消，在下一个批次边界生效
     *
     * @return 该书是否有正在运行的生成
     */
    public boolean cancel(Long bookId) {
        AtomicBoolean flag = cancelFlags.get(bookId);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        logger.info("🛑 已请求取消生成: bookId={}", bookId);
        return true;
    }

    public boolean isRunning(Long bookId) {
        return cancelFlags.containsKey(bookId);
    }

    private void generateChapter(GenerationSession session, Book book, String premise, StoryBible bible,
                                 Chapter chapter, AtomicBoolean cancelled) {
        Long bookId = book.getId();
        int chapterNumber = chapter.getChapterNumber();
        StoryBible.ChapterOutline outline = outlineFor(bookId, bible, chapterNumber);
        List<UnitPlan> plans = chapterPlanner.planUnits(chapterNumber, chapter.getWordTarget());
        store.planUnits(bookId, chapterNumber, toPlannedUnits(outline, plans));
        store.updateChapterStatus(bookId, chapterNumber, Chapter.ChapterStatus.GENERATING);
        logger.info("📖 开始生成第{}章《{}》: 目标字数={}, 单元数={}", chapterNumber, outline.getTitle(),
                chapter.getWordTarget(), plans.size());

        List<UnitPlan> pending = new ArrayList<>();
        for (UnitPlan plan : plans) {
            if (session.isUnitComplete(chapterNumber, plan.getUnitNumber())) {
                continue;
            }
            if (failedUnitQueue.contains(bookId, chapterNumber, plan.getUnitNumber())) {
                continue;
            }
            pending.add(plan);
        }

        int batchSize = Math.max(1, properties.getMaxConcurrentUnits());
        for (int start = 0; start < pending.size(); start += batchSize) {
            checkCancelled(bookId, cancelled);
            List<UnitPlan> batch = pending.subList(start, Math.min(pending.size(), start + batchSize));
            List<UnitDraft> drafts = draftBatch(session, book, premise, outline, batch);
            for (UnitDraft draft : drafts) {
                UnitOutcome outcome = unitCycleRunner.evaluate(session, draft);
                if (!outcome.isPersisted()) {
                    failedUnitQueue.enqueue(bookId, chapterNumber, outcome.getUnitNumber(), outcome.getFailureReason(),
                            outcome.getFailureText(), outcome.getDiagnostics());
                }
            }
            saveCheckpoint(session);
        }

        store.updateChapterStatus(bookId, chapterNumber, chapterStatus(bookId, chapterNumber));
        session.markChapterComplete(chapterNumber);
        saveCheckpoint(session);
    }

    /**
     * 批内并发写作，全部返回后再交给串行评估
     */
    private List<UnitDraft> draftBatch(GenerationSession session, Book book, String premise,
                                       StoryBible.ChapterOutline outline, List<UnitPlan> batch) {
        List<String> characterNotes = characterNotes(session, outline);
        String previousExcerpt = previousExcerpt(book.getId(), outline.getChapterNumber(), batch.get(0).getUnitNumber());
        List<CompletableFuture<UnitDraft>> futures = new ArrayList<>();
        for (UnitPlan plan : batch) {
            UnitWritingRequest request = buildRequest(book, premise, outline, plan, characterNotes,
                    plan == batch.get(0) ? previousExcerpt : null);
            futures.add(CompletableFuture.supplyAsync(() -> unitCycleRunner.draft(request, RequestPriority.NORMAL),
                    unitExecutor));
        }
        List<UnitDraft> drafts = new ArrayList<>();
        for (CompletableFuture<UnitDraft> future : futures) {
            try {
                drafts.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw e;
            }
        }
        return drafts;
    }

    private void drainFailedUnits(GenerationSession session, Book book, String premise, StoryBible bible,
                                  List<Chapter> chapters) {
        Long bookId = book.getId();
        if (failedUnitQueue.listForBook(bookId).isEmpty()) {
            return;
        }
        Map<Integer, Chapter> byNumber = chapters.stream()
                .collect(Collectors.toMap(Chapter::getChapterNumber, c -> c));
        RetryReport retryReport = failedUnitQueue.retryAll(bookId, properties.getMaxUnitRetries(),
                unit -> retryUnit(session, book, premise, bible, byNumber.get(unit.getChapterNumber()), unit));
        logger.info("🔁 失败单元回放: bookId={}, 尝试={}, 恢复={}, 转人工={}", bookId, retryReport.getAttempted(),
                retryReport.getRecovered(), retryReport.getNewlyPermanentlyFailed());
        for (Chapter chapter : chapters) {
            store.updateChapterStatus(bookId, chapter.getChapterNumber(), chapterStatus(bookId, chapter.getChapterNumber()));
        }
        saveCheckpoint(session);
    }

    private RetryOutcome retryUnit(GenerationSession session, Book book, String premise, StoryBible bible,
                                   Chapter chapter, FailedUnit unit) {
        if (chapter == null) {
            return RetryOutcome.failed(unit.getReason(), "章节不存在", unit.getDiagnostics());
        }
        StoryBible.ChapterOutline outline = outlineFor(book.getId(), bible, chapter.getChapterNumber());
        UnitPlan plan = null;
        for (UnitPlan candidate : chapterPlanner.planUnits(chapter.getChapterNumber(), chapter.getWordTarget())) {
            if (candidate.getUnitNumber() == unit.getUnitNumber()) {
                plan = candidate;
            }
        }
        if (plan == null) {
            return RetryOutcome.failed(unit.getReason(), "单元规划不存在", unit.getDiagnostics());
        }
        logger.info("🔄 重试第{}章第{}节（第{}次）", unit.getChapterNumber(), unit.getUnitNumber(), unit.getRetryCount() + 1);
        UnitWritingRequest request = buildRequest(book, premise, outline, plan, characterNotes(session, outline),
                previousExcerpt(book.getId(), plan.getChapterNumber(), plan.getUnitNumber()));
        UnitOutcome outcome = unitCycleRunner.evaluate(session, unitCycleRunner.draft(request, RequestPriority.HIGH));
        if (outcome.isPersisted()) {
            return RetryOutcome.succeeded();
        }
        return RetryOutcome.failed(outcome.getFailureReason(), outcome.getFailureText(), outcome.getDiagnostics());
    }

    /**
     * 审校结果只记录，不影响完成判定
     */
    private void superviseChapters(Long bookId, List<Chapter> chapters) {
        for (Chapter chapter : chapters) {
            int chapterNumber = chapter.getChapterNumber();
            String content = store.listUnits(bookId, chapterNumber).stream()
                    .filter(u -> u.getStatus() == GenerationUnit.UnitStatus.COMPLETE && u.getContent() != null)
                    .sorted(Comparator.comparing(GenerationUnit::getUnitNumber))
                    .map(GenerationUnit::getContent)
                    .collect(Collectors.joining("\n\n"));
            if (StringUtils.isBlank(content)) {
                continue;
            }
            SupervisionResult result;
            try {
                result = supervisionReviewer.review(chapterNumber, 0, content, chapter.getSummary());
            } catch (TextGenerationException e) {
                logger.warn("⚠️ 第{}章整章审校调用失败，不记录审校分: {}", chapterNumber, e.getMessage());
                continue;
            }
            store.updateChapterSupervisionScore(bookId, chapterNumber, result.getScore());
        }
    }

    private List<Chapter> planChapters(Book book, StoryBible bible) {
        List<Integer> targets = chapterPlanner.chapterTargets(book.getTargetWordCount(), book.getChapterCount());
        List<Chapter> chapters = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            int chapterNumber = i + 1;
            StoryBible.ChapterOutline outline = outlineFor(book.getId(), bible, chapterNumber);
            Chapter chapter = new Chapter();
            chapter.setBookId(book.getId());
            chapter.setChapterNumber(chapterNumber);
            chapter.setTitle(outline.getTitle());
            chapter.setSummary(outline.getSummary());
            chapter.setWordTarget(targets.get(i));
            chapter.setStatus(Chapter.ChapterStatus.PLANNED);
            chapters.add(chapter);
        }
        return chapters;
    }

    private List<GenerationUnit> toPlannedUnits(StoryBible.ChapterOutline outline, List<UnitPlan> plans) {
        List<GenerationUnit> units = new ArrayList<>();
        for (UnitPlan plan : plans) {
            GenerationUnit unit = new GenerationUnit();
            unit.setChapterNumber(plan.getChapterNumber());
            unit.setUnitNumber(plan.getUnitNumber());
            unit.setTargetWords(plan.getTargetWords());
            unit.setSceneType(sceneContextFactory.forUnit(outline, plan).getType().getCode());
            unit.setStatus(GenerationUnit.UnitStatus.PLANNED);
            units.add(unit);
        }
        return units;
    }

    private UnitWritingRequest buildRequest(Book book, String premise, StoryBible.ChapterOutline outline, UnitPlan plan,
                                            List<String> characterNotes, String previousExcerpt) {
        SceneContext scene = sceneContextFactory.forUnit(outline, plan);
        return UnitWritingRequest.builder()
                .bookId(book.getId())
                .bookTitle(book.getTitle())
                .premise(premise)
                .chapter(outline)
                .plan(plan)
                .scene(scene)
                .characterNotes(characterNotes)
                .previousExcerpt(previousExcerpt)
                .build();
    }

    private List<String> characterNotes(GenerationSession session, StoryBible.ChapterOutline outline) {
        List<String> notes = new ArrayList<>();
        List<String> names = outline.getCharacters();
        session.getLock().lock();
        try {
            for (CharacterState character : session.getNarrativeState().getCharacters().values()) {
                if (names != null && !names.isEmpty() && !names.contains(character.getName())) {
                    continue;
                }
                StringBuilder note = new StringBuilder(character.getName());
                if (StringUtils.isNotBlank(character.getLocation())) {
                    note.append("，位于").append(character.getLocation());
                }
                if (StringUtils.isNotBlank(character.getEmotionalState())) {
                    note.append("，情绪：").append(character.getEmotionalState());
                }
                if (StringUtils.isNotBlank(character.getPhysicalState())) {
                    note.append("，状态：").append(character.getPhysicalState());
                }
                notes.add(note.toString());
            }
        } finally {
            session.getLock().unlock();
        }
        return notes;
    }

    private String previousExcerpt(Long bookId, int chapterNumber, int unitNumber) {
        if (unitNumber <= 1) {
            return null;
        }
        for (GenerationUnit unit : store.listUnits(bookId, chapterNumber)) {
            if (unit.getUnitNumber() == unitNumber - 1 && StringUtils.isNotBlank(unit.getContent())) {
                String content = unit.getContent();
                return content.length() <= PREVIOUS_EXCERPT_CHARS
                        ? content
                        : content.substring(content.length() - PREVIOUS_EXCERPT_CHARS);
            }
        }
        return null;
    }

    private Chapter.ChapterStatus chapterStatus(Long bookId, int chapterNumber) {
        for (FailedUnit unit : failedUnitQueue.listForBook(bookId)) {
            if (unit.getChapterNumber() == chapterNumber) {
                return Chapter.ChapterStatus.NEEDS_REVISION;
            }
        }
        return Chapter.ChapterStatus.COMPLETE;
    }

    private StoryBible.ChapterOutline outlineFor(Long bookId, StoryBible bible, int chapterNumber) {
        StoryBible.ChapterOutline outline = bible.findChapter(chapterNumber);
        if (outline == null) {
            throw new GenerationException(bookId, "故事圣经缺少第" + chapterNumber + "章大纲", null);
        }
        return outline;
    }

    private StoryBible readStoryBible(Book book) {
        if (StringUtils.isBlank(book.getStoryBible())) {
            throw new GenerationException(book.getId(), "检查点存在但书籍缺少故事圣经，无法续写", null);
        }
        try {
            return objectMapper.readValue(book.getStoryBible(), StoryBible.class);
        } catch (JsonProcessingException e) {
            throw new GenerationException(book.getId(), "故事圣经无法解析: " + e.getOriginalMessage(), e);
        }
    }

    private String writeStoryBible(StoryBible bible) {
        try {
            return objectMapper.writeValueAsString(bible);
        } catch (JsonProcessingException e) {
            throw new GenerationException("故事圣经序列化失败", e);
        }
    }

    private void saveCheckpoint(GenerationSession session) {
        checkpointStore.save(session.toCheckpoint(failedUnitQueue.listForBook(session.getBookId())));
    }

    private GenerationStep advance(Long bookId, GenerationStep current, GenerationStep next) {
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("非法的阶段切换: " + current + " -> " + next);
        }
        store.updateBookState(bookId, Book.BookStatus.GENERATING, next, null);
        return next;
    }

    private void checkCancelled(Long bookId, AtomicBoolean cancelled) {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new GenerationCancelledException("书籍 " + bookId + " 的生成已取消");
        }
    }

    private void markQuietly(Long bookId, Book.BookStatus status, GenerationStep step, String error) {
        try {
            store.updateBookState(bookId, status, step, error);
        } catch (RuntimeException e) {
            logger.error("❌ 更新书籍状态失败: bookId={}, 目标状态={}", bookId, status, e);
        }
    }

    private void report(Long bookId, GenerationStep step, int currentChapter, int totalChapters, int percent,
                        ProgressStatus status, String message, String error) {
        progressReporter.report(GenerationProgress.builder()
                .bookId(bookId)
                .step(step)
                .currentChapter(currentChapter)
                .totalChapters(totalChapters)
                .percentComplete(percent)
                .status(status)
                .message(message)
                .error(error)
                .build());
    }
}
