package com.bookcraft.generation.quality;

import com.bookcraft.config.GenerationProperties;
import com.bookcraft.generation.ai.GenerationGateway;
import com.bookcraft.generation.ai.GenerationOptions;
import com.bookcraft.generation.ratelimit.RequestPriority;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AiContentPolisher implements ContentPolisher {

    private final GenerationGateway gateway;
    private final GenerationProperties properties;

    public AiContentPolisher(GenerationGateway gateway, GenerationProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
    }

    @Override
    public String polish(int chapterNumber, int unitNumber, String content, List<String> suggestions) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("请润色以下小说正文。保持情节、人物、事实与篇幅不变，只提升语言表现力与节奏。\n");
        if (suggestions != null && !suggestions.isEmpty()) {
            prompt.append("\n【编辑建议】\n");
            suggestions.forEach(s -> prompt.append("- ").append(s).append("\n"));
        }
        prompt.append("\n【正文】\n").append(content).append("\n\n直接输出润色后的正文，不要任何说明。");

        GenerationOptions options = GenerationOptions.builder()
                .model(properties.getWritingModel())
                .temperature(0.5)
                .maxTokens(properties.getMaxTokensPerUnit())
                .build();
        return gateway.generate("第" + chapterNumber + "章第" + unitNumber + "节润色", prompt.toString(), options,
                RequestPriority.LOW).getText();
    }
}
