package com.bookcraft.generation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * 单条连贯性问题
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsistencyIssue {

    @NotNull
    private IssueType type;

    @NotNull
    private IssueSeverity severity;

    @NotBlank
    private String description;

    /** 问题在正文中的位置或引文 */
    private String location;

    private String suggestion;
}
