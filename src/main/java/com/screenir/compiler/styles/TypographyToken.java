package com.screenir.compiler.styles;

import lombok.Value;

/**
 * The part of a text style that identifies a type-scale entry.
 */
@Value
public class TypographyToken {
    String fontFamily;
    double fontSize;
    double fontWeight;
    double lineHeight;

    public static TypographyToken of(TypographyStyle style) {
        return new TypographyToken(style.getFontFamily(), style.getFontSize(), style.getFontWeight(),
                style.getLineHeight());
    }
}
