package com.bookcraft.generation.quality;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * 审校打分（同时作为结构化输出的解析目标）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SupervisionResult {

    @NotNull
    @DecimalMin("0")
    @DecimalMax("100")
    private Double score;

    private List<String> strengths = new ArrayList<>();

    private List<String> suggestions = new ArrayList<>();

    /** 结构化输出失败时使用了兜底分 */
    private boolean fallback;

    public static SupervisionResult fallback(double score) {
        return new SupervisionResult(score, new ArrayList<>(), new ArrayList<>(), true);
    }
}
