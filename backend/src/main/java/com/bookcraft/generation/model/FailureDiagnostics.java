package com.bookcraft.generation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 失败单元的诊断信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureDiagnostics {

    private Double consistencyScore;

    private Double supervisionScore;

    private Double combinedScore;

    private String errorMessage;

    public static FailureDiagnostics ofError(String errorMessage) {
        return FailureDiagnostics.builder().errorMessage(errorMessage).build();
    }

    public static FailureDiagnostics ofScores(double consistency, double supervision, double combined) {
        return FailureDiagnostics.builder()
                .consistencyScore(consistency)
                .supervisionScore(supervision)
                .combinedScore(combined)
                .build();
    }
}
