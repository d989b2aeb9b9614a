package com.yhy.nesting.cut.vo;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SheetNestingRequest {
    @NotNull(message = "sheets不能为空")
    private List<SheetCapacity> sheets;
    @NotNull(message = "parts不能为空")
    private List<Part> parts;
    // 以下为空时取配置默认值
    private Double partClearance;
    private Double edgeClearance;
    private RotationOption rotation;
    // 指定后覆盖按牌号查出的密度
    private Double density;
}
