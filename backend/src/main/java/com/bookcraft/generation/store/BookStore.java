package com.bookcraft.generation.store;

import com.bookcraft.domain.entity.Book;
import com.bookcraft.domain.entity.Chapter;
import com.bookcraft.domain.entity.GenerationUnit;
import com.bookcraft.generation.model.GenerationStep;

import java.util.List;

/**
 * 书籍、章节与单元的持久化
 *
 * 单元写入按（书籍, 章节号, 单元号）幂等，重复保存只会覆盖同一行。
 */
public interface BookStore {

    Book findBook(Long bookId);

    void updateBookState(Long bookId, Book.BookStatus status, GenerationStep step, String lastError);

    void savePremise(Long bookId, String premise);

    void saveStoryBible(Long bookId, String storyBibleJson);

    /**
     * 覆盖式写入章节规划（仅在全新生成时调用）
     */
    void replaceChapters(Long bookId, List<Chapter> chapters);

    List<Chapter> listChapters(Long bookId);

    void updateChapterStatus(Long bookId, int chapterNumber, Chapter.ChapterStatus status);

    void updateChapterSupervisionScore(Long bookId, int chapterNumber, double score);

    /**
     * 登记单元规划，已存在的单元保持不变
     */
    void planUnits(Long bookId, int chapterNumber, List<GenerationUnit> units);

    List<GenerationUnit> listUnits(Long bookId, int chapterNumber);

    void saveUnit(GenerationUnit unit);
}
