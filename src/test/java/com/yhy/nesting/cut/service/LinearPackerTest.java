package com.yhy.nesting.cut.service;

import com.yhy.nesting.cut.config.NestingProperties;
import com.yhy.nesting.cut.vo.CutInstance;
import com.yhy.nesting.cut.vo.LinearNestingOptions;
import com.yhy.nesting.cut.vo.LinearNestingResult;
import com.yhy.nesting.cut.vo.LinearPart;
import com.yhy.nesting.cut.vo.OptimizationGoal;
import com.yhy.nesting.cut.vo.StockLayout;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinearPackerTest {

    private final LinearPacker packer = new LinearPacker(new RandomSource(new NestingProperties()));

    private static LinearPart part(long id, String material, double length, int quantity) {
        return LinearPart.withKerf(id, material, length, quantity, 0);
    }

    private static LinearNestingOptions options(double stockLength, OptimizationGoal goal) {
        return LinearNestingOptions.builder().stockLength(stockLength).goal(goal).build();
    }

    private static List<Double> effectiveLengths(StockLayout layout) {
        return layout.getCuts().stream().map(CutInstance::getEffectiveLength).collect(Collectors.toList());
    }

    @Test
    // 基线 FFD：一根料装下 2000,2000,1000
    void firstFitDecreasingBaseline() {
        LinearNestingResult result = packer.pack(
                List.of(part(1, "PIPE", 2000, 2), part(2, "PIPE", 1000, 1)),
                options(6000, OptimizationGoal.PRIORITIZE_SPEED),
                new Random(1));

        assertEquals(1, result.getTotalStockUsed());
        StockLayout layout = result.getLayouts().get(0);
        assertEquals(List.of(2000.0, 2000.0, 1000.0), effectiveLengths(layout));
        assertEquals(5000, layout.getUsedLength(), 1e-9);
        assertEquals(1000, layout.getWasteLength(), 1e-9);
        assertEquals(1000.0 / 6000 * 100, layout.getWastePercentage(), 1e-9);
        assertEquals("PIPE", layout.getRawMaterial());
        assertEquals(1000, result.getTotalWaste(), 1e-9);
        assertTrue(result.getUnplacedParts().isEmpty());
    }

    @Test
    // 超过可用长度的零件直接未排
    void oversizedPartIsRejected() {
        LinearNestingResult result = packer.pack(
                List.of(part(1, "PIPE", 1200, 1)),
                options(1000, OptimizationGoal.MINIMIZE_WASTE),
                new Random(1));

        assertTrue(result.getLayouts().isEmpty());
        assertEquals(0, result.getTotalStockUsed());
        assertEquals(1, result.getUnplacedParts().size());
        assertEquals(1, result.getUnplacedParts().get(0).getQuantity());
        assertEquals(0, result.getTotalWastePercentage());
    }

    @Test
    // 端头余量扣减可用长度，余料仍按整根计算
    void endAllowancesReduceUsableLength() {
        LinearNestingOptions options = LinearNestingOptions.builder()
                .stockLength(1000).leftAllowance(50).rightAllowance(50).build();

        LinearNestingResult result = packer.pack(
                List.of(part(1, "BAR", 900, 2), part(2, "BAR", 901, 1)),
                options,
                new Random(1));

        assertEquals(2, result.getTotalStockUsed());
        for (StockLayout layout : result.getLayouts()) {
            assertEquals(900, layout.getUsedLength(), 1e-9);
            assertEquals(100, layout.getWasteLength(), 1e-9);
        }
        assertEquals(2L, result.getUnplacedParts().get(0).getId());
        assertEquals(1, result.getUnplacedParts().get(0).getQuantity());
    }

    @Test
    // 锯缝计入有效长度
    void kerfCountsTowardsUsedLength() {
        LinearNestingResult result = packer.pack(
                List.of(LinearPart.withKerf(1, "BAR", 495, 3, 5)),
                options(1000, OptimizationGoal.PRIORITIZE_SPEED),
                new Random(1));

        assertEquals(2, result.getTotalStockUsed());
        assertEquals(1000, result.getLayouts().get(0).getUsedLength(), 1e-9);
        assertEquals(495, result.getLayouts().get(0).getCuts().get(0).getLength(), 1e-9);
        assertEquals(500, result.getLayouts().get(1).getUsedLength(), 1e-9);
    }

    @Test
    // 随机搜索的结果不劣于 FFD 基线
    void minimizeWasteImprovesOnBaseline() {
        List<LinearPart> parts = List.of(part(1, "BAR", 7, 1), part(2, "BAR", 5, 2));

        LinearNestingResult speed = packer.pack(parts, options(10, OptimizationGoal.PRIORITIZE_SPEED), new Random(7));
        LinearNestingResult waste = packer.pack(parts, options(10, OptimizationGoal.MINIMIZE_WASTE), new Random(7));

        assertEquals(List.of(7.0), effectiveLengths(speed.getLayouts().get(0)));
        assertEquals(3, speed.getLayouts().get(0).getWasteLength(), 1e-9);
        assertTrue(waste.getLayouts().get(0).getWasteLength() <= speed.getLayouts().get(0).getWasteLength());
        assertEquals(List.of(5.0, 5.0), effectiveLengths(waste.getLayouts().get(0)));
        assertEquals(0, waste.getLayouts().get(0).getWasteLength(), 1e-9);
    }

    @Test
    // 搜索次数为 0 时退化为 FFD
    void zeroIterationsFallsBackToBaseline() {
        List<LinearPart> parts = List.of(part(1, "BAR", 7, 1), part(2, "BAR", 5, 2));
        LinearNestingOptions options = options(10, OptimizationGoal.MINIMIZE_WASTE);
        options.setShuffleIterations(0);

        LinearNestingResult result = packer.pack(parts, options, new Random(7));

        assertEquals(List.of(7.0), effectiveLengths(result.getLayouts().get(0)));
    }

    @Test
    // 相同种子结果可复现
    void seededSearchIsReproducible() {
        List<LinearPart> parts = List.of(
                part(1, "BAR", 1830, 4), part(2, "BAR", 1270, 5), part(3, "BAR", 640, 7), part(4, "BAR", 455, 9));
        LinearNestingOptions options = options(6000, OptimizationGoal.MINIMIZE_WASTE);

        assertEquals(packer.pack(parts, options, new Random(42)), packer.pack(parts, options, new Random(42)));
    }

    @Test
    // 配置了随机种子时 Spring 入口也可复现
    void configuredSeedIsReproducible() {
        NestingProperties properties = new NestingProperties();
        properties.getLinear().setRandomSeed(99L);
        LinearPacker seeded = new LinearPacker(new RandomSource(properties));
        List<LinearPart> parts = List.of(part(1, "BAR", 1830, 4), part(2, "BAR", 1270, 5), part(3, "BAR", 640, 7));
        LinearNestingOptions options = options(6000, OptimizationGoal.MINIMIZE_WASTE);

        assertEquals(seeded.pack(parts, options), seeded.pack(parts, options));
    }

    @Test
    // 速度模式与随机源无关
    void speedModeIsDeterministic() {
        List<LinearPart> parts = List.of(part(1, "BAR", 1830, 4), part(2, "BAR", 1270, 5), part(3, "BAR", 640, 7));
        LinearNestingOptions options = options(6000, OptimizationGoal.PRIORITIZE_SPEED);

        assertEquals(packer.pack(parts, options, new Random(1)), packer.pack(parts, options, new Random(2)));
    }

    @Test
    // 按原材料分组，数量守恒且每根料不超长
    void groupsByMaterialAndConservesQuantities() {
        List<LinearPart> parts = List.of(
                part(1, "ANGLE", 2500, 3),
                part(2, "PIPE", 1800, 4),
                part(3, "ANGLE", 700, 6),
                part(4, "PIPE", 6500, 2),
                part(5, "PIPE", 333, 11));
        double stockLength = 6000;

        LinearNestingResult result = packer.pack(parts, options(stockLength, OptimizationGoal.MINIMIZE_WASTE), new Random(3));

        Map<Long, Integer> placed = new HashMap<>();
        for (StockLayout layout : result.getLayouts()) {
            assertTrue(layout.getUsedLength() <= stockLength);
            for (CutInstance cut : layout.getCuts()) {
                assertEquals(layout.getRawMaterial(), cut.getRawMaterial());
                placed.merge(cut.getId(), 1, Integer::sum);
            }
        }
        Map<Long, Integer> unplaced = new HashMap<>();
        result.getUnplacedParts().forEach(p -> unplaced.merge(p.getId(), p.getQuantity(), Integer::sum));
        for (LinearPart p : parts) {
            assertEquals(p.getQuantity(), placed.getOrDefault(p.getId(), 0) + unplaced.getOrDefault(p.getId(), 0));
        }
        assertEquals(2, unplaced.get(4L));
        assertEquals("ANGLE", result.getLayouts().get(0).getRawMaterial());
        for (int i = 0; i < result.getLayouts().size(); i++) {
            assertEquals(i + 1, result.getLayouts().get(i).getStockIndex());
        }
    }

    @Test
    // 端头余量吃掉全部长度时不开料，所有零件原样报未排
    void noUsableLengthReportsEveryPartUnplaced() {
        LinearNestingOptions options = LinearNestingOptions.builder()
                .stockLength(100).leftAllowance(60).rightAllowance(60)
                .goal(OptimizationGoal.MINIMIZE_WASTE).build();

        LinearNestingResult result = packer.pack(
                List.of(part(1, "BAR", 10, 2), part(2, "PIPE", 100, 1)), options, new Random(1));

        assertTrue(result.getLayouts().isEmpty());
        assertEquals(2, result.getUnplacedParts().size());
        assertEquals(2, result.getUnplacedParts().get(0).getQuantity());
        assertEquals(1, result.getUnplacedParts().get(1).getQuantity());
        assertEquals(0, result.getTotalStockUsed());
    }
}
