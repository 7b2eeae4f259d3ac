package com.screenir.compiler.styles;

import lombok.Value;

import java.util.Map;

@Value
public class StylesBundle {
    Map<String, ExtractedStyle> styles;
    DesignTokens tokens;

    public static StylesBundle empty() {
        return new StylesBundle(Map.of(), DesignTokens.empty());
    }
}
