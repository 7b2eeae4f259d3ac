package com.screenir.compiler.layout;

public enum Overflow {
    VISIBLE,
    SCROLL
}
