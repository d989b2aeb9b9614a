package com.yhy.nesting.cut.vo;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 自动选板排样请求，板材规格由服务端按配置生成。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class SheetPlanningRequest {
    @NotNull(message = "parts不能为空")
    private List<Part> parts;
    private Double partClearance;
    private Double edgeClearance;
    private RotationOption rotation;
    private Double density;
}
