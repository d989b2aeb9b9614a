package com.yhy.nesting.cut.vo;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SheetFillRequest {
    @NotNull(message = "layouts不能为空")
    private List<SheetLayout> layouts;
    @NotNull(message = "fillers不能为空")
    private List<Part> fillers;
    private Double partClearance;
    private Double edgeClearance;
    private RotationOption rotation;
    private Double density;
}
