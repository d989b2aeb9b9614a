package com.yhy.nesting.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class LinearNestingOptions {
    private double stockLength;
    private double leftAllowance;
    private double rightAllowance;
    @Builder.Default
    private OptimizationGoal goal = OptimizationGoal.PRIORITIZE_SPEED;
    @Builder.Default
    private int shuffleIterations = 50;

    public double usableLength() {
        return stockLength - leftAllowance - rightAllowance;
    }
}
