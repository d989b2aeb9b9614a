package com.yhy.nesting.cut.vo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 已放置的单件，创建后不再修改。
 * (x, y) 为左上角坐标。未旋转时水平尺寸为 width、竖直尺寸为 length，rotated 时互换。
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(value = {"extentH", "extentV"}, allowGetters = true)
public class PlacedPart {
    Part part;
    InstanceId instanceId;
    double x;
    double y;
    boolean rotated;

    public static PlacedPart of(Part part, InstanceId instanceId, Placement placement) {
        return PlacedPart.builder()
                .part(part)
                .instanceId(instanceId)
                .x(placement.getX())
                .y(placement.getY())
                .rotated(placement.isRotated())
                .build();
    }

    public double getExtentH() {
        return rotated ? part.getLength() : part.getWidth();
    }

    public double getExtentV() {
        return rotated ? part.getWidth() : part.getLength();
    }

    public double area() {
        return part.area();
    }
}
