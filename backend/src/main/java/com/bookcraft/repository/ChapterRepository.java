package com.bookcraft.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.bookcraft.domain.entity.Chapter;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface ChapterRepository extends BaseMapper<Chapter> {

    @Select("SELECT * FROM chapters WHERE book_id = #{bookId} ORDER BY chapter_number ASC")
    List<Chapter> findByBookOrderByChapterNumberAsc(@Param("bookId") Long bookId);

    @Delete("DELETE FROM chapters WHERE book_id = #{bookId}")
    int deleteByBook(@Param("bookId") Long bookId);
}
