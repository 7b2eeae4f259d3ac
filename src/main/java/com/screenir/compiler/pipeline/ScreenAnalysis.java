package com.screenir.compiler.pipeline;

import com.screenir.compiler.detection.DetectionResult;
import com.screenir.compiler.mapping.TokenMappings;

import lombok.NonNull;
import lombok.Value;

/**
 * A compiled screen with its detection hints and token mappings.
 */
@Value
public class ScreenAnalysis {

    @NonNull
    ScreenIr screen;

    @NonNull
    DetectionResult detection;

    @NonNull
    TokenMappings tokenMappings;
}
