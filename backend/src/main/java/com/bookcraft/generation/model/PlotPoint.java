package com.bookcraft.generation.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlotPoint {

    private int chapter;

    private String description;

    /** major / minor 等，由抽取结果原样保留 */
    private String significance;

    private List<String> involvedCharacters = new ArrayList<>();

    public PlotPoint copy() {
        return new PlotPoint(chapter, description, significance, new ArrayList<>(involvedCharacters));
    }
}
