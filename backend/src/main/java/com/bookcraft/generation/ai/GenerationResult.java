package com.bookcraft.generation.ai;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {

    private String text;

    /** 服务端返回的总 token 用量，缺失时为按字符估算值 */
    private long tokenUsage;
}
