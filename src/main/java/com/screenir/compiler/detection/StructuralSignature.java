package com.screenir.compiler.detection;

import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.ir.SemanticType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Calculates a structural signature for an IR subtree. Two subtrees with the same
 * semantic roles nested the same way have the same signature; names, text and
 * geometry are ignored.
 */
public final class StructuralSignature {

    private StructuralSignature() {
    }

    /**
     * Compact hash of {@link #describe(IrNode)}.
     */
    public static String calculate(IrNode node) {
        return hashString(describe(node));
    }

    /**
     * Readable form, e.g. {@code Card:[Text,Text,Container:[Icon,Text]]}.
     */
    public static String describe(IrNode node) {
        StringBuilder sb = new StringBuilder();
        appendNodeSignature(sb, node);
        return sb.toString();
    }

    /**
     * Same role, and for containers and cards the same child count and the same
     * child roles pairwise.
     */
    public static boolean sameShallowStructure(IrNode a, IrNode b) {
        if (a.getSemanticType() != b.getSemanticType()) {
            return false;
        }
        if (!isContainerLike(a)) {
            return true;
        }
        List<IrNode> left = a.getChildren();
        List<IrNode> right = b.getChildren();
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (left.get(i).getSemanticType() != right.get(i).getSemanticType()) {
                return false;
            }
        }
        return true;
    }

    static boolean isContainerLike(IrNode node) {
        return node.getSemanticType() == SemanticType.CONTAINER || node.getSemanticType() == SemanticType.CARD;
    }

    private static void appendNodeSignature(StringBuilder sb, IrNode node) {
        sb.append(node.getSemanticType().getDisplayName());
        if (isContainerLike(node)) {
            sb.append(":[");
            List<IrNode> children = node.getChildren();
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                appendNodeSignature(sb, children.get(i));
            }
            sb.append(']');
        }
    }

    private static String hashString(String input) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
