package com.yhy.nesting.cut.service;

import cn.hutool.core.util.NumberUtil;
import com.yhy.nesting.cut.vo.LinearNestingResult;
import com.yhy.nesting.cut.vo.LinearPart;
import com.yhy.nesting.cut.vo.Part;
import com.yhy.nesting.cut.vo.SheetCapacity;
import com.yhy.nesting.cut.vo.SheetLayout;
import com.yhy.nesting.cut.vo.SheetNestingResult;
import com.yhy.nesting.cut.vo.StockLayout;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 排样结果的汇总与合并。调用方按牌号/材料分组多次排样后，用这里合并并重新编号。
 */
public final class NestingResults {

    private NestingResults() {
    }

    public static String sheetKey(SheetCapacity sheet) {
        return formatNumber(sheet.getLength()) + "x" + formatNumber(sheet.getWidth()) + "x"
                + formatNumber(sheet.getThickness()) + "-" + sheet.getGrade();
    }

    // 去掉多余的小数零：2.0 -> "2"
    public static String formatNumber(double value) {
        return NumberUtil.toStr(value);
    }

    public static SheetNestingResult summarize(List<SheetLayout> layouts,
                                               List<Part> unplacedParts,
                                               Map<String, Integer> totalSheetsUsed) {
        double totalSheetArea = 0;
        double totalUsedArea = 0;
        double totalUsedWeight = 0;
        double totalWasteWeight = 0;
        for (SheetLayout l : layouts) {
            totalSheetArea += l.getSheet().area();
            totalUsedArea += l.getUsedArea();
            totalUsedWeight += l.getUsedWeight();
            totalWasteWeight += l.getWasteWeight();
        }
        double totalWastePercentage = totalSheetArea > 0 ? ((totalSheetArea - totalUsedArea) / totalSheetArea) * 100 : 0;
        return SheetNestingResult.builder()
                .layouts(layouts)
                .unplacedParts(unplacedParts)
                .totalSheetsUsed(totalSheetsUsed)
                .totalSheetArea(totalSheetArea)
                .totalUsedArea(totalUsedArea)
                .totalUsedWeight(totalUsedWeight)
                .totalWasteWeight(totalWasteWeight)
                .totalWastePercentage(totalWastePercentage)
                .build();
    }

    public static LinearNestingResult summarize(List<StockLayout> layouts, List<LinearPart> unplacedParts) {
        double totalWaste = 0;
        double totalStockLength = 0;
        for (StockLayout l : layouts) {
            totalWaste += l.getWasteLength();
            totalStockLength += l.getStockLength();
        }
        return LinearNestingResult.builder()
                .layouts(layouts)
                .unplacedParts(unplacedParts)
                .totalStockUsed(layouts.size())
                .totalWaste(totalWaste)
                .totalWastePercentage(totalStockLength > 0 ? (totalWaste / totalStockLength) * 100 : 0)
                .build();
    }

    /**
     * 按 originalId 合并，数量累加，保持首次出现的顺序。
     */
    public static List<Part> consolidateParts(Collection<Part> parts) {
        Map<Long, Part> byOriginal = new LinkedHashMap<>();
        for (Part p : parts) {
            byOriginal.merge(p.getOriginalId(), p.toBuilder().build(),
                    (a, b) -> a.toBuilder().quantity(a.getQuantity() + b.getQuantity()).build());
        }
        return new ArrayList<>(byOriginal.values());
    }

    /**
     * 按 id 合并，数量累加。
     */
    public static List<LinearPart> consolidateLinearParts(Collection<LinearPart> parts) {
        Map<Long, LinearPart> byId = new LinkedHashMap<>();
        for (LinearPart p : parts) {
            byId.merge(p.getId(), p.toBuilder().build(),
                    (a, b) -> a.toBuilder().quantity(a.getQuantity() + b.getQuantity()).build());
        }
        return new ArrayList<>(byId.values());
    }

    public static SheetNestingResult mergeSheetResults(List<SheetNestingResult> results) {
        List<SheetLayout> layouts = new ArrayList<>();
        List<Part> unplaced = new ArrayList<>();
        Map<String, Integer> sheetsUsed = new LinkedHashMap<>();
        for (SheetNestingResult r : results) {
            for (SheetLayout l : r.getLayouts()) {
                layouts.add(l.toBuilder()
                        .sheetIndex(layouts.size() + 1)
                        .placedParts(new ArrayList<>(l.getPlacedParts()))
                        .build());
            }
            unplaced.addAll(r.getUnplacedParts());
            r.getTotalSheetsUsed().forEach((k, v) -> sheetsUsed.merge(k, v, Integer::sum));
        }
        return summarize(layouts, consolidateParts(unplaced), sheetsUsed);
    }

    public static LinearNestingResult mergeLinearResults(List<LinearNestingResult> results) {
        List<StockLayout> layouts = new ArrayList<>();
        List<LinearPart> unplaced = new ArrayList<>();
        for (LinearNestingResult r : results) {
            for (StockLayout l : r.getLayouts()) {
                layouts.add(l.toBuilder()
                        .stockIndex(layouts.size() + 1)
                        .cuts(new ArrayList<>(l.getCuts()))
                        .build());
            }
            unplaced.addAll(r.getUnplacedParts());
        }
        return summarize(layouts, consolidateLinearParts(unplaced));
    }
}
