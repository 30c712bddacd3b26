package com.bookcraft.generation.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimelineEntry {

    private int chapter;

    private String event;

    /** 文本中的时间表述，如"第二天清晨" */
    private String timeReference;

    public TimelineEntry copy() {
        return new TimelineEntry(chapter, event, timeReference);
    }
}
