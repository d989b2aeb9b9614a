package com.yhy.nesting.cut.service;

import com.yhy.nesting.cut.config.NestingProperties;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * 为型材随机搜索提供随机数发生器。配置了 random-seed 时每次返回同种子的新实例，结果可复现。
 */
@Component
public class RandomSource {

    private final Long seed;

    public RandomSource(NestingProperties properties) {
        this.seed = properties.getLinear().getRandomSeed();
    }

    public Random next() {
        return seed != null ? new Random(seed) : new Random();
    }
}
