package com.yhy.nesting.cut.service;

import cn.hutool.core.util.StrUtil;
import com.yhy.nesting.cut.config.NestingProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 基于配置 nesting.densities 的密度表，牌号不区分大小写。
 */
@Component
public class MaterialDensityTable implements DensityLookup {

    private final Map<String, Double> densities = new HashMap<>();
    private final double defaultDensity;

    public MaterialDensityTable(NestingProperties properties) {
        properties.getDensities().forEach((grade, density) -> {
            if (StrUtil.isNotBlank(grade) && density != null && density > 0) {
                densities.put(grade.trim().toUpperCase(), density);
            }
        });
        this.defaultDensity = properties.getDefaultDensity();
    }

    @Override
    public OptionalDouble densityOf(String grade) {
        if (StrUtil.isBlank(grade)) {
            return OptionalDouble.empty();
        }
        Double density = densities.get(grade.trim().toUpperCase());
        return density == null ? OptionalDouble.empty() : OptionalDouble.of(density);
    }

    public double getDefaultDensity() {
        return defaultDensity;
    }
}
