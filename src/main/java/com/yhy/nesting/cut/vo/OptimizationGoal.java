package com.yhy.nesting.cut.vo;

public enum OptimizationGoal {
    PRIORITIZE_SPEED,
    MINIMIZE_WASTE
}
