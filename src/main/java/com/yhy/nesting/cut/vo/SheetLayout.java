package com.yhy.nesting.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一张实际使用的板材及其排样结果。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder(toBuilder = true)
public class SheetLayout {
    private SheetCapacity sheet;
    private int sheetIndex;
    @Builder.Default
    private List<PlacedPart> placedParts = new ArrayList<>();
    private double usedArea;
    private double wasteArea;
    private double wastePercentage;
    private double usedWeight;
    private double wasteWeight;

    /**
     * 按已放置零件重新计算面积与重量。density 单位 kg/m³。
     */
    public void recalculate(double density) {
        double sheetArea = sheet.area();
        usedArea = placedParts.stream().mapToDouble(PlacedPart::area).sum();
        wasteArea = sheetArea - usedArea;
        wastePercentage = sheetArea > 0 ? (wasteArea / sheetArea) * 100 : 0;
        usedWeight = weightOf(usedArea, sheet.getThickness(), density);
        wasteWeight = weightOf(wasteArea, sheet.getThickness(), density);
    }

    // mm² × mm × kg/m³ -> kg
    public static double weightOf(double areaMm2, double thicknessMm, double density) {
        return (areaMm2 / 1_000_000) * thicknessMm * density / 1000;
    }
}
