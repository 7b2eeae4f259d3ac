package com.screenir.compiler.ir;

public enum SemanticType {
    CONTAINER("Container"),
    TEXT("Text"),
    IMAGE("Image"),
    BUTTON("Button"),
    CARD("Card"),
    ICON("Icon"),
    COMPONENT("Component"),
    REPEATER("Repeater");

    private final String displayName;

    SemanticType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
