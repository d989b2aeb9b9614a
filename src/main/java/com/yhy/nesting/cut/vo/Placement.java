package com.yhy.nesting.cut.vo;

import lombok.Value;

@Value
public class Placement {
    double x;
    double y;
    boolean rotated;
}
