package com.yhy.nesting.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class SheetNestingResult {
    @Builder.Default
    private List<SheetLayout> layouts = new ArrayList<>();
    // 按 originalId 合并后的未排零件，quantity 为剩余数量
    @Builder.Default
    private List<Part> unplacedParts = new ArrayList<>();
    // key: 长x宽x厚-牌号
    @Builder.Default
    private Map<String, Integer> totalSheetsUsed = new LinkedHashMap<>();
    private double totalUsedWeight;
    private double totalWasteWeight;
    private double totalWastePercentage;
    private double totalUsedArea;
    private double totalSheetArea;
}
