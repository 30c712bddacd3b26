package com.bookcraft.generation.queue;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetryReport {

    private int attempted;

    private int recovered;

    /** 本轮新转为人工修订的单元数 */
    private int newlyPermanentlyFailed;

    /** 本轮结束后仍在队列中的单元数（含永久失败） */
    private int remaining;
}
