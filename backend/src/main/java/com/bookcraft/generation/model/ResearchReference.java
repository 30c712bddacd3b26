package com.bookcraft.generation.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResearchReference {

    private String fact;

    private String source;

    /** 首次引用章节，初始化阶段导入的资料为 0 */
    private int chapter;

    public ResearchReference copy() {
        return new ResearchReference(fact, source, chapter);
    }
}
