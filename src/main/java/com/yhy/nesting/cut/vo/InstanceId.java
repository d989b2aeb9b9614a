package com.yhy.nesting.cut.vo;

import cn.hutool.core.lang.Assert;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * 展开后单件的标识：(原始零件 id, 序号)。
 */
@Value
public class InstanceId {
    long partId;
    int index;

    @JsonCreator
    public static InstanceId parse(String text) {
        // 以最后一个 '-' 分隔，零件 id 可为负数
        String trimmed = StrUtil.trim(text);
        Assert.isTrue(StrUtil.contains(trimmed, '-'), "非法的单件标识: {}", text);
        String partId = StrUtil.subBefore(trimmed, '-', true);
        String index = StrUtil.subAfter(trimmed, '-', true);
        Assert.isTrue(StrUtil.isNotBlank(partId) && StrUtil.isNotBlank(index), "非法的单件标识: {}", text);
        return new InstanceId(Long.parseLong(partId), Integer.parseInt(index));
    }

    @JsonValue
    @Override
    public String toString() {
        return partId + "-" + index;
    }
}
