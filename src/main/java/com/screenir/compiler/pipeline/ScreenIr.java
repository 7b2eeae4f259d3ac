package com.screenir.compiler.pipeline;

import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.normalize.SafeAreaInsets;
import com.screenir.compiler.styles.StylesBundle;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One compiled screen: the IR tree and the styles its nodes refer to.
 */
@Value
@Builder
public class ScreenIr {

    @NonNull
    String id;

    @NonNull
    String name;

    @NonNull
    IrNode root;

    @NonNull
    StylesBundle stylesBundle;

    @NonNull
    @Builder.Default
    SafeAreaInsets safeAreaInsets = SafeAreaInsets.NONE;

    boolean hasSafeAreaLayout;
}
