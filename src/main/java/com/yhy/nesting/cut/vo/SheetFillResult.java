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
public class SheetFillResult {
    @Builder.Default
    private List<SheetLayout> layouts = new ArrayList<>();
    // 未能塞入的填充件，quantity 为剩余数量
    @Builder.Default
    private List<Part> remainingFillers = new ArrayList<>();
    private int placedCount;
}
