package com.bookcraft.generation.orchestrator;

import com.bookcraft.config.GenerationProperties;
import com.bookcraft.generation.model.UnitPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 章节字数与单元切分
 */
@Component
public class ChapterPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ChapterPlanner.class);

    private final GenerationProperties properties;

    public ChapterPlanner(GenerationProperties properties) {
        this.properties = properties;
    }

    /**
     * 按位置系数分配各章目标字数，最大余数法取整，总和严格等于全书目标
     */
    public List<Integer> chapterTargets(int totalWords, int chapterCount) {
        if (chapterCount <= 0) {
            throw new IllegalArgumentException("chapterCount must be positive");
        }
        double[] multipliers = new double[chapterCount];
        double sum = 0;
        for (int i = 0; i < chapterCount; i++) {
            multipliers[i] = positionMultiplier(i + 1, chapterCount);
            sum += multipliers[i];
        }
        int[] targets = new int[chapterCount];
        double[] remainders = new double[chapterCount];
        int assigned = 0;
        for (int i = 0; i < chapterCount; i++) {
            double exact = totalWords * multipliers[i] / sum;
            targets[i] = (int) Math.floor(exact);
            remainders[i] = exact - targets[i];
            assigned += targets[i];
        }
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < chapterCount; i++) {
            order.add(i);
        }
        order.sort(Comparator.<Integer>comparingDouble(i -> remainders[i]).reversed().thenComparingInt(i -> i));
        int leftover = totalWords - assigned;
        for (int k = 0; k < leftover; k++) {
            targets[order.get(k % chapterCount)]++;
        }
        List<Integer> result = new ArrayList<>(chapterCount);
        for (int target : targets) {
            result.add(target);
        }
        return result;
    }

    /**
     * 开篇（前20%）×1.10，高潮段（70%-90%）×1.15，结尾（90%之后）×1.05，其余 ×1.00
     */
    public static double positionMultiplier(int chapterNumber, int chapterCount) {
        double position = (double) chapterNumber / chapterCount;
        if (position <= 0.2) {
            return 1.10;
        }
        if (position > 0.9) {
            return 1.05;
        }
        if (position >= 0.7) {
            return 1.15;
        }
        return 1.0;
    }

    /**
     * 单元数：目标字数 / 理想单元字数，保持每单元字数在 [min, max] 区间，并限制在 [minUnits, maxUnits]
     */
    public int unitCount(int chapterWords) {
        int ideal = properties.getIdealUnitWords();
        int min = properties.getMinUnitWords();
        int max = properties.getMaxUnitWords();
        int count;
        if (chapterWords <= max) {
            count = 1;
        } else {
            count = (int) Math.ceil((double) chapterWords / ideal);
            double average = (double) chapterWords / count;
            if (average > max) {
                count = (int) Math.ceil((double) chapterWords / max);
            } else if (average < min && count > 1) {
                count = Math.max(1, chapterWords / min);
            }
        }
        int clamped = Math.max(properties.getMinUnitsPerChapter(), Math.min(properties.getMaxUnitsPerChapter(), count));
        if (clamped != count) {
            // 单元数上下限优先于每单元字数区间
            logger.warn("⚠️ 章节 {} 字被限制为 {} 个单元，每单元约 {} 字，超出 [{}, {}] 区间", chapterWords, clamped,
                    chapterWords / clamped, min, max);
        }
        return clamped;
    }

    /**
     * 均分字数，余数从最后一个单元往前补
     */
    public List<UnitPlan> planUnits(int chapterNumber, int chapterWords) {
        int count = unitCount(chapterWords);
        int base = chapterWords / count;
        int extra = chapterWords % count;
        List<UnitPlan> plans = new ArrayList<>(count);
        for (int unit = 1; unit <= count; unit++) {
            int words = base + (unit > count - extra ? 1 : 0);
            plans.add(new UnitPlan(chapterNumber, unit, count, words));
        }
        return plans;
    }
}
