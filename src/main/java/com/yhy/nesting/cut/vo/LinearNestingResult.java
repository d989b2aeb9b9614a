package com.yhy.nesting.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class LinearNestingResult {
    @Builder.Default
    private List<StockLayout> layouts = new ArrayList<>();
    // 按 id 合并，quantity 为未排数量之和
    @Builder.Default
    private List<LinearPart> unplacedParts = new ArrayList<>();
    private int totalStockUsed;
    private double totalWaste;
    private double totalWastePercentage;
}
