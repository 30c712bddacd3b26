package com.bookcraft.generation.continuity;

import com.bookcraft.config.ContinuityProperties;
import com.bookcraft.generation.ai.ExtractionResult;
import com.bookcraft.generation.ai.GenerationOptions;
import com.bookcraft.generation.ai.StructuredOutputExtractor;
import com.bookcraft.generation.exception.ContinuityCheckException;
import com.bookcraft.generation.model.ConsistencyIssue;
import com.bookcraft.generation.model.ConsistencyIssuesResponse;
import com.bookcraft.generation.model.ConsistencyReport;
import com.bookcraft.generation.model.IssueSeverity;
import com.bookcraft.generation.model.IssueType;
import com.bookcraft.generation.model.StoryBible;
import com.bookcraft.generation.model.TrackerUpdates;
import com.bookcraft.generation.session.GenerationSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContinuityTrackerTest {

    private static final String CONTENT = "Alice 推开厨房的门，炉火还在烧。";

    @Mock
    private StructuredOutputExtractor extractor;

    private ContinuityProperties properties;
    private ContinuityTracker tracker;
    private GenerationSession session;

    @BeforeEach
    void setUp() {
        properties = new ContinuityProperties();
        tracker = new ContinuityTracker(extractor, new ContinuityPromptBuilder(properties), new NarrativeStateUpdater(),
                new ConsistencyScorer(), properties);
        session = GenerationSession.start(7L);
        StoryBible.CharacterSeed alice = new StoryBible.CharacterSeed();
        alice.setName("Alice");
        alice.setRole("主角");
        tracker.initialize(session, Collections.singletonList(alice), null, Collections.emptyList());
    }

    private void stubTrackerUpdate(ExtractionResult<TrackerUpdates> result) {
        when(extractor.extract(anyString(), anyString(), any(GenerationOptions.class), eq(TrackerUpdates.class), anyInt()))
                .thenReturn(result);
    }

    private void stubAllChecks(ExtractionResult<ConsistencyIssuesResponse> result) {
        when(extractor.extract(anyString(), anyString(), any(GenerationOptions.class),
                eq(ConsistencyIssuesResponse.class), anyInt())).thenReturn(result);
    }

    private void stubCheck(String contextPrefix, ExtractionResult<ConsistencyIssuesResponse> result) {
        when(extractor.extract(startsWith(contextPrefix), anyString(), any(GenerationOptions.class),
                eq(ConsistencyIssuesResponse.class), anyInt())).thenReturn(result);
    }

    private static TrackerUpdates aliceInKitchen() {
        TrackerUpdates updates = new TrackerUpdates();
        TrackerUpdates.CharacterUpdate alice = new TrackerUpdates.CharacterUpdate();
        alice.setName("Alice");
        alice.setLocation("Kitchen");
        updates.getCharacters().add(alice);
        return updates;
    }

    private static ConsistencyIssuesResponse issues(ConsistencyIssue... issues) {
        ConsistencyIssuesResponse response = new ConsistencyIssuesResponse();
        Collections.addAll(response.getIssues(), issues);
        return response;
    }

    @Test
    @DisplayName("the unit updates the narrative state before it is checked")
    void should_ApplyUpdatesAndScore_When_AllChecksParse() {
        stubTrackerUpdate(ExtractionResult.success(aliceInKitchen()));
        stubAllChecks(ExtractionResult.success(issues()));
        stubCheck("第1章时间线检查", ExtractionResult.success(issues(ConsistencyIssue.builder()
                .type(IssueType.TIMELINE).severity(IssueSeverity.MINOR).description("昼夜矛盾").build())));

        ConsistencyReport report = tracker.checkUnit(session, 1, CONTENT, "Alice 回家", Collections.emptyList());

        assertThat(session.getNarrativeState().findCharacter("Alice").getLocation()).isEqualTo("Kitchen");
        assertThat(report.getIssues()).hasSize(1);
        assertThat(report.getOverallScore()).isEqualTo(100 - 1.5 * 5);
        assertThat(report.getCategoryScores()).hasSize(IssueType.values().length);
        assertThat(report.getParseErrors()).isEmpty();
        verify(extractor).extract(startsWith("第1章角色检查[Alice]"), anyString(), any(GenerationOptions.class),
                eq(ConsistencyIssuesResponse.class), anyInt());
    }

    @Test
    @DisplayName("research is only checked when the unit references facts")
    void should_SkipResearchCheck_When_NoFactsReferenced() {
        stubTrackerUpdate(ExtractionResult.success(new TrackerUpdates()));
        stubAllChecks(ExtractionResult.success(issues()));

        tracker.checkUnit(session, 1, CONTENT, null, null);

        verify(extractor, never()).extract(startsWith("第1章资料检查"), anyString(), any(GenerationOptions.class),
                eq(ConsistencyIssuesResponse.class), anyInt());
    }

    @Test
    @DisplayName("an unparseable critical category fails the check")
    void should_Throw_When_CriticalCategoryCannotBeParsed() {
        stubTrackerUpdate(ExtractionResult.success(new TrackerUpdates()));
        stubCheck("第1章角色检查", ExtractionResult.failed(Collections.singletonList("JSON解析失败")));

        assertThatThrownBy(() -> tracker.checkUnit(session, 1, CONTENT, null, Collections.emptyList()))
                .isInstanceOf(ContinuityCheckException.class)
                .satisfies(e -> assertThat(((ContinuityCheckException) e).getCategory()).isEqualTo(IssueType.CHARACTER));
    }

    @Test
    @DisplayName("an unparseable non-critical category degrades to zero issues")
    void should_Degrade_When_NonCriticalCategoryCannotBeParsed() {
        stubTrackerUpdate(ExtractionResult.success(new TrackerUpdates()));
        stubAllChecks(ExtractionResult.success(issues()));
        stubCheck("第1章世界观检查", ExtractionResult.failed(Collections.singletonList("JSON解析失败")));

        ConsistencyReport report = tracker.checkUnit(session, 1, CONTENT, null, Collections.emptyList());

        assertThat(report.getOverallScore()).isEqualTo(100.0);
        assertThat(report.getParseErrors()).anyMatch(e -> e.contains("世界观检查"));
    }

    @Test
    @DisplayName("the critical set is configuration")
    void should_Degrade_When_CharacterIsNotConfiguredCritical() {
        properties.setCriticalCategories(EnumSet.of(IssueType.TIMELINE));
        stubTrackerUpdate(ExtractionResult.success(new TrackerUpdates()));
        stubAllChecks(ExtractionResult.success(issues()));
        stubCheck("第1章角色检查", ExtractionResult.failed(Collections.singletonList("JSON解析失败")));

        ConsistencyReport report = tracker.checkUnit(session, 1, CONTENT, null, Collections.emptyList());

        assertThat(report.getParseErrors()).isNotEmpty();
    }

    @Test
    @DisplayName("a failed state extraction is recorded unless configured critical")
    void should_HonourTrackerPolicy_When_StateExtractionFails() {
        stubTrackerUpdate(ExtractionResult.failed(Collections.singletonList("输出为空")));
        stubAllChecks(ExtractionResult.success(issues()));

        ConsistencyReport report = tracker.checkUnit(session, 1, CONTENT, null, Collections.emptyList());
        assertThat(report.getParseErrors()).anyMatch(e -> e.contains("状态更新抽取失败"));
        assertThat(session.getNarrativeState().findCharacter("Alice").getLocation()).isNull();

        properties.setTrackerExtractionCritical(true);
        assertThatThrownBy(() -> tracker.checkUnit(session, 2, CONTENT, null, Collections.emptyList()))
                .isInstanceOf(ContinuityCheckException.class);
    }
}
