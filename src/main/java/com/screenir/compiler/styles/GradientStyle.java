package com.screenir.compiler.styles;

import com.screenir.compiler.model.raw.Fill;

import lombok.Value;

import java.util.List;

@Value
public class GradientStyle {
    Fill.GradientType type;
    List<String> colors;
    List<Double> positions;
}
