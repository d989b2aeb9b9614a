package com.yhy.nesting.cut.vo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 可采购的一种板材规格。quantity 为 null 表示不限量。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class SheetCapacity {
    private String id;
    private double length;
    private double width;
    private double thickness;
    private String grade;
    private Integer quantity;

    @JsonIgnore
    public boolean isUnbounded() {
        return quantity == null;
    }

    public double area() {
        return length * width;
    }

    public boolean accepts(String grade, double thickness) {
        return this.grade != null && this.grade.equals(grade) && Double.compare(this.thickness, thickness) == 0;
    }
}
