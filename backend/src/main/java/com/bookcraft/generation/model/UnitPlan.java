package com.bookcraft.generation.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnitPlan {

    private int chapterNumber;

    private int unitNumber;

    private int totalUnits;

    private int targetWords;

    public boolean isFirst() {
        return unitNumber == 1;
    }

    public boolean isLast() {
        return unitNumber == totalUnits;
    }
}
