package com.yhy.nesting.cut.vo;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class LinearNestingRequest {
    @NotNull(message = "items不能为空")
    private List<LinearPart> items;
    @NotNull(message = "stockLength不能为空")
    private BigDecimal stockLength;
    private BigDecimal leftAllowance;
    private BigDecimal rightAllowance;
    // 锯缝，加到每件长度上
    private BigDecimal kerf;
    private OptimizationGoal goal;
    private Integer shuffleIterations;
}
