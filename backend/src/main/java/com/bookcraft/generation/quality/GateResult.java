package com.bookcraft.generation.quality;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 质量门的判定结果与最终正文
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GateResult {

    private QualityDecision decision;

    private double consistencyScore;

    private double supervisionScore;

    private double combinedScore;

    /** REJECT 时为原文；POLISH 且润色成功时为润色后的正文 */
    private String content;

    private boolean polished;

    public boolean isAccepted() {
        return decision != QualityDecision.REJECT;
    }
}
