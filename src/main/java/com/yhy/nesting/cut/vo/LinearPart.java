package com.yhy.nesting.cut.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 型材零件。effectiveLength = length + kerf，由调用方预先算好。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder(toBuilder = true)
public class LinearPart {
    private long id;
    private String rawMaterial;
    private double length;
    private int quantity;
    private double effectiveLength;

    public static LinearPart withKerf(long id, String rawMaterial, double length, int quantity, double kerf) {
        return new LinearPart(id, rawMaterial, length, quantity, length + kerf);
    }
}
