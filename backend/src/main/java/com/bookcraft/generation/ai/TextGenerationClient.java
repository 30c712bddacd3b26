package com.bookcraft.generation.ai;

/**
 * 外部文本生成能力
 */
public interface TextGenerationClient {

    /**
     * @throws TextGenerationException 调用失败，isTransient() 区分可重试与致命错误
     */
    GenerationResult generate(String prompt, GenerationOptions options);
}
