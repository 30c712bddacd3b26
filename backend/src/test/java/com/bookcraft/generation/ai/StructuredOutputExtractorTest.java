package com.bookcraft.generation.ai;

import com.bookcraft.generation.model.ConsistencyIssuesResponse;
import com.bookcraft.generation.model.IssueSeverity;
import com.bookcraft.generation.model.IssueType;
import com.bookcraft.generation.model.TrackerUpdates;
import com.bookcraft.generation.ratelimit.RequestPriority;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.validation.Validation;
import javax.validation.ValidatorFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StructuredOutputExtractorTest {

    private static final String VALID_JSON = "{\"issues\": [{\"type\": \"timeline\", \"severity\": \"major\","
            + " \"description\": \"时间倒流\"}], \"successfulElements\": [\"人物动机清晰\"]}";

    private static ValidatorFactory validatorFactory;

    @Mock
    private GenerationGateway gateway;

    private StructuredOutputExtractor extractor;

    private final GenerationOptions options = GenerationOptions.builder().model("gpt-4o-mini").build();

    @BeforeAll
    static void initValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        extractor = new StructuredOutputExtractor(gateway, new ObjectMapper(), validatorFactory.getValidator());
    }

    @Test
    @DisplayName("bare JSON decodes strictly")
    void should_ReturnSuccess_When_OutputIsBareJson() {
        ExtractionResult<ConsistencyIssuesResponse> result = extractor.decode(VALID_JSON, ConsistencyIssuesResponse.class);

        assertThat(result.getStatus()).isEqualTo(ExtractionResult.Status.SUCCESS);
        assertThat(result.getValue().getIssues()).hasSize(1);
        assertThat(result.getValue().getIssues().get(0).getType()).isEqualTo(IssueType.TIMELINE);
        assertThat(result.getValue().getIssues().get(0).getSeverity()).isEqualTo(IssueSeverity.MAJOR);
    }

    @Test
    @DisplayName("fenced JSON with chatter decodes leniently as partial")
    void should_ReturnPartial_When_OutputIsWrappedInCodeFence() {
        String raw = "```json\n" + VALID_JSON + "\n```\n以上是检查结果。";

        ExtractionResult<ConsistencyIssuesResponse> result = extractor.decode(raw, ConsistencyIssuesResponse.class);

        assertThat(result.getStatus()).isEqualTo(ExtractionResult.Status.PARTIAL);
        assertThat(result.isUsable()).isTrue();
        assertThat(result.getValue().getSuccessfulElements()).containsExactly("人物动机清晰");
    }

    @Test
    @DisplayName("garbage output fails")
    void should_ReturnFailed_When_OutputHasNoJson() {
        ExtractionResult<ConsistencyIssuesResponse> result = extractor.decode("抱歉，我无法完成这个请求。",
                ConsistencyIssuesResponse.class);

        assertThat(result.getStatus()).isEqualTo(ExtractionResult.Status.FAILED);
        assertThat(result.getValue()).isNull();
        assertThat(result.getErrors()).isNotEmpty();
    }

    @Test
    @DisplayName("JSON that violates the schema fails validation")
    void should_ReturnFailed_When_RequiredFieldMissing() {
        ExtractionResult<ConsistencyIssuesResponse> result = extractor.decode(
                "{\"issues\": [{\"type\": \"timeline\", \"severity\": \"major\"}]}", ConsistencyIssuesResponse.class);

        assertThat(result.getStatus()).isEqualTo(ExtractionResult.Status.FAILED);
        assertThat(result.getErrors()).anyMatch(e -> e.contains("description"));
    }

    @Test
    @DisplayName("null list elements fail validation")
    void should_ReturnFailed_When_ListContainsNullElement() {
        ExtractionResult<ConsistencyIssuesResponse> issues = extractor.decode("{\"issues\": [null]}",
                ConsistencyIssuesResponse.class);
        ExtractionResult<TrackerUpdates> updates = extractor.decode("{\"characters\": [null], \"plotPoints\": []}",
                TrackerUpdates.class);

        assertThat(issues.getStatus()).isEqualTo(ExtractionResult.Status.FAILED);
        assertThat(issues.getErrors()).anyMatch(e -> e.contains("issues"));
        assertThat(updates.getStatus()).isEqualTo(ExtractionResult.Status.FAILED);
        assertThat(updates.getErrors()).anyMatch(e -> e.contains("characters"));
    }

    @Test
    @DisplayName("a failed decode re-prompts for bare JSON and then succeeds")
    void should_RepromptWithStricterInstruction_When_FirstOutputUnparseable() {
        when(gateway.generate(anyString(), anyString(), any(GenerationOptions.class), eq(RequestPriority.NORMAL)))
                .thenReturn(new GenerationResult("这不是JSON", 10))
                .thenReturn(new GenerationResult(VALID_JSON, 20));

        ExtractionResult<ConsistencyIssuesResponse> result = extractor.extract("测试", "原始提示", options,
                ConsistencyIssuesResponse.class, 2);

        assertThat(result.getStatus()).isEqualTo(ExtractionResult.Status.SUCCESS);
        assertThat(result.getAttempts()).isEqualTo(2);
        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(gateway, times(2)).generate(anyString(), prompts.capture(), any(GenerationOptions.class),
                eq(RequestPriority.NORMAL));
        assertThat(prompts.getAllValues().get(0)).isEqualTo("原始提示");
        assertThat(prompts.getAllValues().get(1)).startsWith("原始提示").contains("只输出一个合法的JSON对象");
    }

    @Test
    @DisplayName("reprompts are bounded")
    void should_StopAfterMaxReprompts_When_OutputNeverParses() {
        when(gateway.generate(anyString(), anyString(), any(GenerationOptions.class), eq(RequestPriority.NORMAL)))
                .thenReturn(new GenerationResult("garbage", 5));

        ExtractionResult<ConsistencyIssuesResponse> result = extractor.extract("测试", "原始提示", options,
                ConsistencyIssuesResponse.class, 1);

        assertThat(result.getStatus()).isEqualTo(ExtractionResult.Status.FAILED);
        assertThat(result.getAttempts()).isEqualTo(2);
        verify(gateway, times(2)).generate(anyString(), anyString(), any(GenerationOptions.class),
                eq(RequestPriority.NORMAL));
    }

    @Test
    @DisplayName("a generation failure propagates instead of counting as unparseable output")
    void should_Rethrow_When_GatewayThrows() {
        when(gateway.generate(anyString(), anyString(), any(GenerationOptions.class), eq(RequestPriority.NORMAL)))
                .thenThrow(TextGenerationException.timeout("测试 调用超时", null));

        assertThatThrownBy(() -> extractor.extract("测试", "原始提示", options, ConsistencyIssuesResponse.class, 3))
                .isInstanceOf(TextGenerationException.class)
                .satisfies(e -> assertThat(((TextGenerationException) e).isTimeout()).isTrue());
        verify(gateway, times(1)).generate(anyString(), anyString(), any(GenerationOptions.class),
                eq(RequestPriority.NORMAL));
    }
}
