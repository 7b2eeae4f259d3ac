package com.screenir.compiler.normalize;

import lombok.Value;

@Value
public class SafeAreaInsets {

    public static final SafeAreaInsets NONE = new SafeAreaInsets(0, 0, 0, 0);

    double top;
    double bottom;
    double left;
    double right;

    public boolean isZero() {
        return top == 0 && bottom == 0 && left == 0 && right == 0;
    }
}
