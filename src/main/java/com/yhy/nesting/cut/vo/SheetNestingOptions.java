package com.yhy.nesting.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class SheetNestingOptions {
    private double partClearance;
    private double edgeClearance;
    @Builder.Default
    private RotationOption rotation = RotationOption.NINETY;
    // 牌号查不到密度时使用，kg/m³
    @Builder.Default
    private double fallbackDensity = 7850;
}
