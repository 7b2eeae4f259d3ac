package com.screenir.compiler.styles;

import com.screenir.compiler.model.raw.TypographyInfo;

import lombok.Value;

@Value
public class TypographyStyle {
    String fontFamily;
    double fontSize;
    double fontWeight;
    double lineHeight;
    double letterSpacing;
    TypographyInfo.TextAlign textAlign;
    String color;
}
