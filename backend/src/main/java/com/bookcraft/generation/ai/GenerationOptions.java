package com.bookcraft.generation.ai;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单次生成调用的参数
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GenerationOptions {

    /** 模型名，同时作为限流的模型类别 */
    private String model;

    @Builder.Default
    private double temperature = 0.7;

    @Builder.Default
    private int maxTokens = 4000;

    private String systemPrompt;
}
