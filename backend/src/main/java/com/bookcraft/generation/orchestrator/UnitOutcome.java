package com.bookcraft.generation.orchestrator;

import com.bookcraft.generation.model.FailureDiagnostics;
import com.bookcraft.generation.model.FailureReason;
import com.bookcraft.generation.quality.QualityDecision;
import lombok.Getter;

/**
 * 一个单元走完生成周期后的结果
 */
@Getter
public final class UnitOutcome {

    private final int chapterNumber;
    private final int unitNumber;
    private final boolean persisted;
    private final QualityDecision decision;
    private final FailureReason failureReason;
    private final String failureText;
    private final FailureDiagnostics diagnostics;

    private UnitOutcome(int chapterNumber, int unitNumber, boolean persisted, QualityDecision decision,
                        FailureReason failureReason, String failureText, FailureDiagnostics diagnostics) {
        this.chapterNumber = chapterNumber;
        this.unitNumber = unitNumber;
        this.persisted = persisted;
        this.decision = decision;
        this.failureReason = failureReason;
        this.failureText = failureText;
        this.diagnostics = diagnostics;
    }

    public static UnitOutcome persisted(int chapterNumber, int unitNumber, QualityDecision decision,
                                        FailureDiagnostics scores) {
        return new UnitOutcome(chapterNumber, unitNumber, true, decision, null, null, scores);
    }

    public static UnitOutcome failed(int chapterNumber, int unitNumber, QualityDecision decision, FailureReason reason,
                                     String text, FailureDiagnostics diagnostics) {
        return new UnitOutcome(chapterNumber, unitNumber, false, decision, reason, text, diagnostics);
    }
}
