package com.yhy.nesting.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder(toBuilder = true)
public class StockLayout {
    private int stockIndex;
    private double stockLength;
    @Builder.Default
    private List<CutInstance> cuts = new ArrayList<>();
    private double usedLength;
    private double wasteLength;
    private double wastePercentage;
    private String rawMaterial;

    public static StockLayout of(int stockIndex, double stockLength, String rawMaterial, List<CutInstance> cuts) {
        double used = cuts.stream().mapToDouble(CutInstance::getEffectiveLength).sum();
        double waste = stockLength - used;
        return StockLayout.builder()
                .stockIndex(stockIndex)
                .stockLength(stockLength)
                .rawMaterial(rawMaterial)
                .cuts(new ArrayList<>(cuts))
                .usedLength(used)
                .wasteLength(waste)
                .wastePercentage(stockLength > 0 ? (waste / stockLength) * 100 : 0)
                .build();
    }
}
