package com.bookcraft.generation.session;

import com.bookcraft.generation.model.FailedUnit;
import com.bookcraft.generation.model.GenerationCheckpoint;
import com.bookcraft.generation.model.NarrativeState;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单本书的生成会话
 *
 * 持有实时叙事状态与已完成集合，所有修改都在会话锁内进行；检查点是它唯一的持久化形式。
 */
public class GenerationSession {

    private final Long bookId;
    private final NarrativeState narrativeState;
    private final SortedSet<Integer> completedChapters;
    private final Map<Integer, SortedSet<Integer>> completedUnits;
    private final ReentrantLock lock = new ReentrantLock();

    private GenerationSession(Long bookId, NarrativeState narrativeState, SortedSet<Integer> completedChapters,
                              Map<Integer, SortedSet<Integer>> completedUnits) {
        this.bookId = bookId;
        this.narrativeState = narrativeState;
        this.completedChapters = completedChapters;
        this.completedUnits = completedUnits;
    }

    public static GenerationSession start(Long bookId) {
        return new GenerationSession(bookId, new NarrativeState(), new TreeSet<>(), new TreeMap<>());
    }

    public static GenerationSession fromCheckpoint(GenerationCheckpoint checkpoint) {
        NarrativeState state = checkpoint.getNarrativeState() != null
                ? checkpoint.getNarrativeState().deepCopy()
                : new NarrativeState();
        SortedSet<Integer> chapters = checkpoint.getCompletedChapters() != null
                ? new TreeSet<>(checkpoint.getCompletedChapters())
                : new TreeSet<>();
        Map<Integer, SortedSet<Integer>> units = new TreeMap<>();
        if (checkpoint.getCompletedUnits() != null) {
            checkpoint.getCompletedUnits().forEach((chapter, set) -> units.put(chapter, new TreeSet<>(set)));
        }
        return new GenerationSession(checkpoint.getBookId(), state, chapters, units);
    }

    /**
     * 生成检查点快照（深拷贝，之后的修改不影响快照）
     */
    public GenerationCheckpoint toCheckpoint(List<FailedUnit> failedUnits) {
        lock.lock();
        try {
            Map<Integer, SortedSet<Integer>> units = new TreeMap<>();
            completedUnits.forEach((chapter, set) -> units.put(chapter, new TreeSet<>(set)));
            List<FailedUnit> failed = new ArrayList<>();
            if (failedUnits != null) {
                failedUnits.forEach(unit -> failed.add(unit.copy()));
            }
            return GenerationCheckpoint.builder()
                    .bookId(bookId)
                    .narrativeState(narrativeState.deepCopy())
                    .completedChapters(new TreeSet<>(completedChapters))
                    .completedUnits(units)
                    .failedUnits(failed)
                    .timestamp(LocalDateTime.now())
                    .version(GenerationCheckpoint.CURRENT_VERSION)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public void markUnitComplete(int chapterNumber, int unitNumber) {
        lock.lock();
        try {
            completedUnits.computeIfAbsent(chapterNumber, k -> new TreeSet<>()).add(unitNumber);
        } finally {
            lock.unlock();
        }
    }

    public boolean isUnitComplete(int chapterNumber, int unitNumber) {
        lock.lock();
        try {
            SortedSet<Integer> units = completedUnits.get(chapterNumber);
            return units != null && units.contains(unitNumber);
        } finally {
            lock.unlock();
        }
    }

    public void markChapterComplete(int chapterNumber) {
        lock.lock();
        try {
            completedChapters.add(chapterNumber);
        } finally {
            lock.unlock();
        }
    }

    public boolean isChapterComplete(int chapterNumber) {
        lock.lock();
        try {
            return completedChapters.contains(chapterNumber);
        } finally {
            lock.unlock();
        }
    }

    public SortedSet<Integer> getCompletedChapters() {
        lock.lock();
        try {
            return Collections.unmodifiableSortedSet(new TreeSet<>(completedChapters));
        } finally {
            lock.unlock();
        }
    }

    public SortedSet<Integer> getCompletedUnits(int chapterNumber) {
        lock.lock();
        try {
            SortedSet<Integer> units = completedUnits.get(chapterNumber);
            return units == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(new TreeSet<>(units));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 叙事状态只能在持有 getLock() 时读写
     */
    public NarrativeState getNarrativeState() {
        return narrativeState;
    }

    public ReentrantLock getLock() {
        return lock;
    }

    public Long getBookId() {
        return bookId;
    }
}
