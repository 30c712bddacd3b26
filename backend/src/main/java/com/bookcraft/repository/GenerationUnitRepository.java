package com.bookcraft.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.bookcraft.domain.entity.GenerationUnit;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface GenerationUnitRepository extends BaseMapper<GenerationUnit> {

    @Select("SELECT * FROM generation_units WHERE book_id = #{bookId} AND chapter_number = #{chapterNumber} ORDER BY unit_number ASC")
    List<GenerationUnit> findByChapter(@Param("bookId") Long bookId, @Param("chapterNumber") Integer chapterNumber);

    @Select("SELECT * FROM generation_units WHERE book_id = #{bookId} AND chapter_number = #{chapterNumber} AND unit_number = #{unitNumber}")
    GenerationUnit findUnit(@Param("bookId") Long bookId, @Param("chapterNumber") Integer chapterNumber,
                            @Param("unitNumber") Integer unitNumber);

    @Select("SELECT COUNT(*) FROM generation_units WHERE book_id = #{bookId} AND status = #{status}")
    long countByBookAndStatus(@Param("bookId") Long bookId, @Param("status") String status);

    @Delete("DELETE FROM generation_units WHERE book_id = #{bookId}")
    int deleteByBook(@Param("bookId") Long bookId);
}
