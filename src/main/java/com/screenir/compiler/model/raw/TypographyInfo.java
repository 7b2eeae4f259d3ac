package com.screenir.compiler.model.raw;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TypographyInfo {

    public enum TextAlign {
        LEFT,
        CENTER,
        RIGHT,
        JUSTIFY
    }

    @NonNull
    @Builder.Default
    String fontFamily = "System";

    @Builder.Default
    double fontSize = 14;

    @Builder.Default
    double fontWeight = 400;

    double lineHeight;

    double letterSpacing;

    @NonNull
    @Builder.Default
    TextAlign textAlign = TextAlign.LEFT;
}
