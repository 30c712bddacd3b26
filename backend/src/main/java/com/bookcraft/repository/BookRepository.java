package com.bookcraft.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.bookcraft.domain.entity.Book;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface BookRepository extends BaseMapper<Book> {

    /**
     * 只更新状态相关字段，避免覆盖大字段
     */
    @Update("UPDATE books SET status = #{status}, generation_step = #{step}, last_error = #{lastError}, updated_at = NOW() WHERE id = #{id}")
    int updateState(@Param("id") Long id, @Param("status") String status, @Param("step") String step,
                    @Param("lastError") String lastError);
}
