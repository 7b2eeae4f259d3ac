package com.screenir.compiler.recognize;

import com.screenir.compiler.ir.SemanticType;
import com.screenir.compiler.layout.LayoutNode;

import lombok.NonNull;
import lombok.Value;

import java.util.function.Predicate;

/**
 * One entry of the classifier's ordered rule list.
 */
@Value
public class ClassificationRule {

    @NonNull
    SemanticType type;

    @NonNull
    Predicate<LayoutNode> predicate;

    public boolean matches(LayoutNode node) {
        return predicate.test(node);
    }
}
