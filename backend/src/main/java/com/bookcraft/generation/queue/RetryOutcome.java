package com.bookcraft.generation.queue;

import com.bookcraft.generation.model.FailureDiagnostics;
import com.bookcraft.generation.model.FailureReason;
import lombok.Getter;

/**
 * 单次重试的结果
 */
@Getter
public final class RetryOutcome {

    private final boolean success;
    private final FailureReason reason;
    private final String reasonText;
    private final FailureDiagnostics diagnostics;

    private RetryOutcome(boolean success, FailureReason reason, String reasonText, FailureDiagnostics diagnostics) {
        this.success = success;
        this.reason = reason;
        this.reasonText = reasonText;
        this.diagnostics = diagnostics;
    }

    public static RetryOutcome succeeded() {
        return new RetryOutcome(true, null, null, null);
    }

    public static RetryOutcome failed(FailureReason reason, String reasonText, FailureDiagnostics diagnostics) {
        return new RetryOutcome(false, reason, reasonText, diagnostics);
    }
}
