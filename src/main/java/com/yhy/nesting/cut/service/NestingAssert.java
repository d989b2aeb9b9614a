package com.yhy.nesting.cut.service;

import cn.hutool.core.lang.Assert;
import com.yhy.nesting.cut.vo.LinearPart;
import com.yhy.nesting.cut.vo.Part;
import com.yhy.nesting.cut.vo.SheetCapacity;
import com.yhy.nesting.cut.vo.SheetNestingOptions;

import java.util.List;

/**
 * 入参校验。上游解析已保证这些约束，这里违反即快速失败，避免面积/重量统计被悄悄污染。
 */
final class NestingAssert {

    private NestingAssert() {
    }

    static void checkParts(List<Part> parts) {
        Assert.notNull(parts, "零件列表不能为空");
        for (Part p : parts) {
            Assert.notNull(p, "零件不能为 null");
            Assert.isTrue(p.getLength() > 0 && p.getWidth() > 0 && p.getThickness() > 0,
                    "零件 {} 尺寸必须为正: {}x{}x{}", p.getId(), p.getLength(), p.getWidth(), p.getThickness());
            Assert.isTrue(p.getQuantity() >= 0, "零件 {} 数量不能为负: {}", p.getId(), p.getQuantity());
        }
    }

    static void checkSheets(List<SheetCapacity> sheets) {
        Assert.notNull(sheets, "板材列表不能为空");
        for (SheetCapacity s : sheets) {
            Assert.notNull(s, "板材不能为 null");
            Assert.isTrue(s.getLength() > 0 && s.getWidth() > 0 && s.getThickness() > 0,
                    "板材 {} 尺寸必须为正: {}x{}x{}", s.getId(), s.getLength(), s.getWidth(), s.getThickness());
            Assert.isTrue(s.isUnbounded() || s.getQuantity() >= 0, "板材 {} 数量不能为负: {}", s.getId(), s.getQuantity());
        }
    }

    static void checkOptions(SheetNestingOptions options) {
        Assert.notNull(options, "排样参数不能为空");
        Assert.isTrue(options.getPartClearance() >= 0 && options.getEdgeClearance() >= 0,
                "间距不能为负: 零件间距 {}, 边距 {}", options.getPartClearance(), options.getEdgeClearance());
        Assert.notNull(options.getRotation(), "旋转选项不能为空");
    }

    static void checkLinearParts(List<LinearPart> parts) {
        Assert.notNull(parts, "零件列表不能为空");
        for (LinearPart p : parts) {
            Assert.notNull(p, "零件不能为 null");
            Assert.notBlank(p.getRawMaterial(), "零件 {} 未指定原材料", p.getId());
            Assert.isTrue(p.getLength() > 0, "零件 {} 长度必须为正: {}", p.getId(), p.getLength());
            Assert.isTrue(p.getEffectiveLength() >= p.getLength(),
                    "零件 {} 有效长度 {} 小于名义长度 {}", p.getId(), p.getEffectiveLength(), p.getLength());
            Assert.isTrue(p.getQuantity() >= 0, "零件 {} 数量不能为负: {}", p.getId(), p.getQuantity());
        }
    }
}
