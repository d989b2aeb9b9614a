package com.yhy.nesting.cut.service;

import java.util.OptionalDouble;

/**
 * 牌号 -> 密度（kg/m³）。查不到时返回 empty，由排样方使用兜底密度。
 */
@FunctionalInterface
public interface DensityLookup {

    OptionalDouble densityOf(String grade);

    static DensityLookup fixed(double density) {
        return grade -> OptionalDouble.of(density);
    }

    static DensityLookup none() {
        return grade -> OptionalDouble.empty();
    }
}
