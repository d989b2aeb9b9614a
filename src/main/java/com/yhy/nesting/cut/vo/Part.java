package com.yhy.nesting.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 板材零件。未旋转放置时 width 沿板材 length 方向（x 轴），length 沿板材 width 方向（y 轴）。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder(toBuilder = true)
public class Part {
    private long id;
    // 同一零件的多行共用 originalId
    private long originalId;
    private String name;
    private double length;
    private double width;
    private double thickness;
    private String grade;
    private int quantity;

    public double area() {
        return length * width;
    }
}
