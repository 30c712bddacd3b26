package com.bookcraft.generation.orchestrator;

import com.bookcraft.config.GenerationProperties;
import com.bookcraft.generation.model.UnitPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(OutputCaptureExtension.class)
class ChapterPlannerTest {

    private ChapterPlanner planner;

    @BeforeEach
    void setUp() {
        planner = new ChapterPlanner(new GenerationProperties());
    }

    @Test
    @DisplayName("chapter targets sum exactly to the book total and every unit count stays in [1,5]")
    void should_SumToBookTotal_When_SplittingSixtyThousandWordsIntoTenChapters() {
        List<Integer> targets = planner.chapterTargets(60000, 10);

        assertThat(targets).hasSize(10);
        assertThat(targets.stream().mapToInt(Integer::intValue).sum()).isEqualTo(60000);
        for (int i = 0; i < targets.size(); i++) {
            int units = planner.unitCount(targets.get(i));
            assertThat(units).isBetween(1, 5);
            List<UnitPlan> plans = planner.planUnits(i + 1, targets.get(i));
            assertThat(plans).hasSize(units);
            assertThat(plans.stream().mapToInt(UnitPlan::getTargetWords).sum()).isEqualTo(targets.get(i));
        }
    }

    @Test
    @DisplayName("opening and climax chapters get more words than the middle")
    void should_WeightOpeningAndClimax_When_ComputingTargets() {
        List<Integer> targets = planner.chapterTargets(60000, 10);

        assertThat(targets.get(0)).isGreaterThan(targets.get(4));
        assertThat(targets.get(7)).isGreaterThan(targets.get(0));
        assertThat(targets.get(9)).isGreaterThan(targets.get(4));
    }

    @Test
    @DisplayName("position multipliers follow the opening, climax and ending bands")
    void should_ReturnBandMultiplier_When_GivenChapterPosition() {
        assertThat(ChapterPlanner.positionMultiplier(1, 10)).isEqualTo(1.10);
        assertThat(ChapterPlanner.positionMultiplier(2, 10)).isEqualTo(1.10);
        assertThat(ChapterPlanner.positionMultiplier(5, 10)).isEqualTo(1.0);
        assertThat(ChapterPlanner.positionMultiplier(7, 10)).isEqualTo(1.15);
        assertThat(ChapterPlanner.positionMultiplier(9, 10)).isEqualTo(1.15);
        assertThat(ChapterPlanner.positionMultiplier(10, 10)).isEqualTo(1.05);
    }

    @Test
    @DisplayName("short chapters are a single unit, long chapters are capped at five")
    void should_ClampUnitCount_When_ChapterIsShortOrLong() {
        assertThat(planner.unitCount(900)).isEqualTo(1);
        assertThat(planner.unitCount(1200)).isEqualTo(1);
        assertThat(planner.unitCount(3000)).isEqualTo(3);
        assertThat(planner.unitCount(20000)).isEqualTo(5);
    }

    @Test
    @DisplayName("a climax chapter capped at five units exceeds the per-unit maximum and says so")
    void should_WarnAboutUnitSize_When_UnitCapOverridesWordBand(CapturedOutput output) {
        List<Integer> targets = planner.chapterTargets(60000, 10);
        int climax = targets.get(8);

        List<UnitPlan> plans = planner.planUnits(9, climax);

        assertThat(plans).hasSize(5);
        assertThat(plans.get(0).getTargetWords()).isGreaterThan(1200);
        assertThat(output.getOut()).contains("被限制为 5 个单元");
    }

    @Test
    @DisplayName("leftover words go to the last units")
    void should_GiveRemainderToLastUnits_When_WordsDoNotDivideEvenly() {
        List<UnitPlan> plans = planner.planUnits(3, 3002);

        assertThat(plans).extracting(UnitPlan::getTargetWords).containsExactly(1000, 1001, 1001);
        assertThat(plans.get(0).isFirst()).isTrue();
        assertThat(plans.get(2).isLast()).isTrue();
        assertThat(plans).allMatch(p -> p.getChapterNumber() == 3 && p.getTotalUnits() == 3);
    }

    @Test
    @DisplayName("a book must have at least one chapter")
    void should_Reject_When_ChapterCountIsZero() {
        assertThatThrownBy(() -> planner.chapterTargets(1000, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
