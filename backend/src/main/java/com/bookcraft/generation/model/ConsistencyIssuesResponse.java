package com.bookcraft.generation.model;

import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * 单个类别检查的结构化输出
 */
@Data
public class ConsistencyIssuesResponse {

    @NotNull
    private List<@NotNull @Valid ConsistencyIssue> issues = new ArrayList<>();

    /** 本次检查中处理得当的要素，用于报告里的正向反馈 */
    private List<String> successfulElements = new ArrayList<>();
}
