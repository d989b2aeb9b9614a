package com.yhy.nesting.cut.vo;

/**
 * 旋转选项。FREE 目前与 NINETY 相同，只尝试 90° 旋转。
 */
public enum RotationOption {
    NONE,
    NINETY,
    FREE;

    public boolean allowsRotation() {
        return this != NONE;
    }
}
