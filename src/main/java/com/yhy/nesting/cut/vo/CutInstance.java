package com.yhy.nesting.cut.vo;

import lombok.Value;

/**
 * 型材零件的单件，只在排料过程中存在，最终进入某根料或退回未排列表。
 */
@Value
public class CutInstance {
    long id;
    double length;
    double effectiveLength;
    InstanceId instanceId;
    String rawMaterial;

    public static CutInstance of(LinearPart part, int index) {
        return new CutInstance(part.getId(), part.getLength(), part.getEffectiveLength(),
                new InstanceId(part.getId(), index), part.getRawMaterial());
    }
}
