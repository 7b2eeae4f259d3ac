package com.screenir.compiler.model.raw;

import lombok.Value;

@Value
public class Padding {

    public static final Padding ZERO = new Padding(0, 0, 0, 0);

    double top;
    double right;
    double bottom;
    double left;

    public boolean isZero() {
        return top == 0 && right == 0 && bottom == 0 && left == 0;
    }
}
