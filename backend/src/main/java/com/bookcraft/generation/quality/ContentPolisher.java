package com.bookcraft.generation.quality;

import java.util.List;

/**
 * 正文润色
 */
public interface ContentPolisher {

    String polish(int chapterNumber, int unitNumber, String content, List<String> suggestions);
}
