package com.screenir.compiler.normalize;

import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Chrome found on a screen, the insets it implies, and the node ids to drop from
 * the render tree.
 */
@Value
public class SafeAreaDetection {

    public static final SafeAreaDetection NONE =
            new SafeAreaDetection(SafeAreaInsets.NONE, List.of(), Set.of(), false);

    SafeAreaInsets insets;
    List<ChromeElement> chromeElements;
    Set<String> excludeIds;
    boolean hasSafeAreaLayout;
}
