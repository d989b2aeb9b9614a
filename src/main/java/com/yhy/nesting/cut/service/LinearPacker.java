package com.yhy.nesting.cut.service;

import cn.hutool.core.lang.Assert;
import com.yhy.nesting.cut.vo.CutInstance;
import com.yhy.nesting.cut.vo.InstanceId;
import com.yhy.nesting.cut.vo.LinearNestingOptions;
import com.yhy.nesting.cut.vo.LinearNestingResult;
import com.yhy.nesting.cut.vo.LinearPart;
import com.yhy.nesting.cut.vo.OptimizationGoal;
import com.yhy.nesting.cut.vo.StockLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 型材下料（一维）
 * - 按原材料分组，有效长度超过可用长度的零件直接未排
 * - 每根料先按有效长度降序贪心装填（FFD 基线）
 * - MINIMIZE_WASTE 时再做若干次随机打乱 + 贪心，取废料最小的方案，同分保留先找到的
 */
@Service
public class LinearPacker {

    private static final Logger LOGGER = LoggerFactory.getLogger(LinearPacker.class);

    private static final Comparator<CutInstance> BY_EFFECTIVE_LENGTH_DESC =
            Comparator.comparingDouble(CutInstance::getEffectiveLength).reversed();

    private final RandomSource randomSource;

    public LinearPacker(RandomSource randomSource) {
        this.randomSource = randomSource;
    }

    public LinearNestingResult pack(List<LinearPart> parts, LinearNestingOptions options) {
        return pack(parts, options, randomSource.next());
    }

    public LinearNestingResult pack(List<LinearPart> parts, LinearNestingOptions options, Random random) {
        NestingAssert.checkLinearParts(parts);
        Assert.notNull(options, "下料参数不能为空");
        Assert.notNull(random, "随机数发生器不能为空");
        Assert.isTrue(options.getStockLength() > 0, "原材料长度必须为正: {}", options.getStockLength());
        Assert.isTrue(options.getLeftAllowance() >= 0 && options.getRightAllowance() >= 0,
                "端头余量不能为负: {} / {}", options.getLeftAllowance(), options.getRightAllowance());
        Assert.isTrue(options.getShuffleIterations() >= 0, "随机搜索次数不能为负: {}", options.getShuffleIterations());

        double stockLength = options.getStockLength();
        // 可用长度不为正时所有零件都在超长检查中被拒绝
        double usableLength = options.usableLength();
        boolean minimizeWaste = options.getGoal() == OptimizationGoal.MINIMIZE_WASTE;

        LOGGER.info("型材下料开始: 零件 {} 行, 原材料长度 {}, 可用长度 {}, 目标 {}",
                parts.size(), stockLength, usableLength, options.getGoal());

        List<StockLayout> layouts = new ArrayList<>();
        List<LinearPart> unplaced = new ArrayList<>();

        Map<String, List<LinearPart>> groups = parts.stream()
                .collect(Collectors.groupingBy(LinearPart::getRawMaterial, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<String, List<LinearPart>> entry : groups.entrySet()) {
            String rawMaterial = entry.getKey();
            List<LinearPart> partsInGroup = entry.getValue();

            List<CutInstance> remaining = new ArrayList<>();
            Map<Long, Integer> nextIndex = new HashMap<>();
            for (LinearPart p : partsInGroup) {
                if (p.getQuantity() <= 0) continue;
                if (p.getEffectiveLength() > usableLength) {
                    LOGGER.warn("零件 {} 有效长度 {} 超过可用长度 {}, 直接未排", p.getId(), p.getEffectiveLength(), usableLength);
                    unplaced.add(p);
                    continue;
                }
                for (int i = 0; i < p.getQuantity(); i++) {
                    remaining.add(CutInstance.of(p, nextIndex.merge(p.getId(), 1, Integer::sum) - 1));
                }
            }

            while (!remaining.isEmpty()) {
                List<CutInstance> sorted = new ArrayList<>(remaining);
                sorted.sort(BY_EFFECTIVE_LENGTH_DESC);
                List<CutInstance> bestCuts = fillGreedy(sorted, usableLength);
                double bestWaste = usableLength - usedLength(bestCuts);

                if (minimizeWaste && remaining.size() > 1) {
                    List<CutInstance> shuffled = new ArrayList<>(remaining);
                    for (int i = 0; i < options.getShuffleIterations(); i++) {
                        Collections.shuffle(shuffled, random);
                        List<CutInstance> currentCuts = fillGreedy(shuffled, usableLength);
                        double currentWaste = usableLength - usedLength(currentCuts);
                        if (currentWaste < bestWaste) {
                            bestWaste = currentWaste;
                            bestCuts = currentCuts;
                        }
                    }
                }

                if (bestCuts.isEmpty()) {
                    // 前面已拦截超长件，正常不会走到这里
                    LOGGER.warn("原材料 {} 剩余 {} 件无法装入任何一根料", rawMaterial, remaining.size());
                    remaining.forEach(c -> unplaced.add(toPart(c)));
                    break;
                }

                StockLayout layout = StockLayout.of(layouts.size() + 1, stockLength, rawMaterial, bestCuts);
                layouts.add(layout);
                LOGGER.debug("第 {} 根 {}: {} 段, 余料 {}", layout.getStockIndex(), rawMaterial,
                        layout.getCuts().size(), layout.getWasteLength());

                Set<InstanceId> placedIds = bestCuts.stream().map(CutInstance::getInstanceId).collect(Collectors.toSet());
                remaining.removeIf(c -> placedIds.contains(c.getInstanceId()));
            }
        }

        LinearNestingResult result = NestingResults.summarize(layouts, NestingResults.consolidateLinearParts(unplaced));
        LOGGER.info("型材下料完成: 用料 {} 根, 总余料 {}, 余料率 {}%, 未排零件 {} 种",
                result.getTotalStockUsed(), result.getTotalWaste(), result.getTotalWastePercentage(),
                result.getUnplacedParts().size());
        return result;
    }

    private List<CutInstance> fillGreedy(List<CutInstance> order, double usableLength) {
        List<CutInstance> cuts = new ArrayList<>();
        double used = 0;
        for (CutInstance c : order) {
            if (used + c.getEffectiveLength() <= usableLength) {
                cuts.add(c);
                used += c.getEffectiveLength();
            }
        }
        return cuts;
    }

    private double usedLength(List<CutInstance> cuts) {
        return cuts.stream().mapToDouble(CutInstance::getEffectiveLength).sum();
    }

    private LinearPart toPart(CutInstance c) {
        return LinearPart.builder()
                .id(c.getId())
                .rawMaterial(c.getRawMaterial())
                .length(c.getLength())
                .effectiveLength(c.getEffectiveLength())
                .quantity(1)
                .build();
    }
}
