package com.bookcraft.generation.store;

import com.baomidou.mybatisplus.core.conditions.update.UpdateWrapper;
import com.bookcraft.domain.entity.Book;
import com.bookcraft.domain.entity.Chapter;
import com.bookcraft.domain.entity.GenerationUnit;
import com.bookcraft.generation.model.GenerationStep;
import com.bookcraft.repository.BookRepository;
import com.bookcraft.repository.ChapterRepository;
import com.bookcraft.repository.GenerationUnitRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * MyBatis-Plus 实现
 */
@Component
public class MybatisBookStore implements BookStore {

    private final BookRepository bookRepository;
    private final ChapterRepository chapterRepository;
    private final GenerationUnitRepository unitRepository;

    public MybatisBookStore(BookRepository bookRepository,
                            ChapterRepository chapterRepository,
                            GenerationUnitRepository unitRepository) {
        this.bookRepository = bookRepository;
        this.chapterRepository = chapterRepository;
        this.unitRepository = unitRepository;
    }

    @Override
    public Book findBook(Long bookId) {
        return bookRepository.selectById(bookId);
    }

    @Override
    public void updateBookState(Long bookId, Book.BookStatus status, GenerationStep step, String lastError) {
        bookRepository.updateState(bookId, status.name(), step != null ? step.name() : null, lastError);
    }

    @Override
    public void savePremise(Long bookId, String premise) {
        UpdateWrapper<Book> wrapper = new UpdateWrapper<>();
        wrapper.eq("id", bookId).set("premise", premise);
        bookRepository.update(null, wrapper);
    }

    @Override
    public void saveStoryBible(Long bookId, String storyBibleJson) {
        UpdateWrapper<Book> wrapper = new UpdateWrapper<>();
        wrapper.eq("id", bookId).set("story_bible", storyBibleJson);
        bookRepository.update(null, wrapper);
    }

    @Override
    @Transactional
    public void replaceChapters(Long bookId, List<Chapter> chapters) {
        unitRepository.deleteByBook(bookId);
        chapterRepository.deleteByBook(bookId);
        for (Chapter chapter : chapters) {
            chapter.setId(null);
            chapter.setBookId(bookId);
            chapterRepository.insert(chapter);
        }
    }

    @Override
    public List<Chapter> listChapters(Long bookId) {
        return chapterRepository.findByBookOrderByChapterNumberAsc(bookId);
    }

    @Override
    public void updateChapterStatus(Long bookId, int chapterNumber, Chapter.ChapterStatus status) {
        UpdateWrapper<Chapter> wrapper = new UpdateWrapper<>();
        wrapper.eq("book_id", bookId).eq("chapter_number", chapterNumber).set("status", status.name());
        chapterRepository.update(null, wrapper);
    }

    @Override
    public void updateChapterSupervisionScore(Long bookId, int chapterNumber, double score) {
        UpdateWrapper<Chapter> wrapper = new UpdateWrapper<>();
        wrapper.eq("book_id", bookId).eq("chapter_number", chapterNumber).set("supervision_score", score);
        chapterRepository.update(null, wrapper);
    }

    @Override
    @Transactional
    public void planUnits(Long bookId, int chapterNumber, List<GenerationUnit> units) {
        for (GenerationUnit unit : units) {
            if (unitRepository.findUnit(bookId, chapterNumber, unit.getUnitNumber()) == null) {
                unit.setBookId(bookId);
                unit.setChapterNumber(chapterNumber);
                unitRepository.insert(unit);
            }
        }
    }

    @Override
    public List<GenerationUnit> listUnits(Long bookId, int chapterNumber) {
        return unitRepository.findByChapter(bookId, chapterNumber);
    }

    @Override
    @Transactional
    public void saveUnit(GenerationUnit unit) {
        GenerationUnit existing = unitRepository.findUnit(unit.getBookId(), unit.getChapterNumber(), unit.getUnitNumber());
        if (existing == null) {
            unit.setId(null);
            unitRepository.insert(unit);
        } else {
            unit.setId(existing.getId());
            unitRepository.updateById(unit);
        }
    }
}
