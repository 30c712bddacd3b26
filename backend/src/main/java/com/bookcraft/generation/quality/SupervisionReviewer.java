package com.bookcraft.generation.quality;

/**
 * 审校评分
 */
public interface SupervisionReviewer {

    /**
     * @param unitNumber 章节整体审校时为 0
     */
    SupervisionResult review(int chapterNumber, int unitNumber, String content, String summary);
}
