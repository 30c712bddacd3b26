package com.bookcraft.generation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 失败队列中的单元记录
 */
@Data
@NoArgsConstructor
public class FailedUnit {

    private Long bookId;

    private int chapterNumber;

    private int unitNumber;

    private FailureReason reason;

    private String reasonText;

    private LocalDateTime failedAt;

    private int retryCount;

    /** 达到重试上限后置位，之后不再自动重试，等待人工修订 */
    private boolean permanentlyFailed;

    private FailureDiagnostics diagnostics;

    public FailedUnit(Long bookId, int chapterNumber, int unitNumber) {
        this.bookId = bookId;
        this.chapterNumber = chapterNumber;
        this.unitNumber = unitNumber;
    }

    @JsonIgnore
    public String getUnitKey() {
        return chapterNumber + "-" + unitNumber;
    }

    public FailedUnit copy() {
        FailedUnit copy = new FailedUnit(bookId, chapterNumber, unitNumber);
        copy.reason = reason;
        copy.reasonText = reasonText;
        copy.failedAt = failedAt;
        copy.retryCount = retryCount;
        copy.permanentlyFailed = permanentlyFailed;
        if (diagnostics != null) {
            copy.diagnostics = new FailureDiagnostics(diagnostics.getConsistencyScore(), diagnostics.getSupervisionScore(),
                    diagnostics.getCombinedScore(), diagnostics.getErrorMessage());
        }
        return copy;
    }
}
