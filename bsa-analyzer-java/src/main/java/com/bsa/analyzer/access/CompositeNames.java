package com.bsa.analyzer.access;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.ExpressionText;
import com.bsa.analyzer.ast.NodeType;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured names for storage locations: {@code base.member}, {@code base[index]} and
 * nested {@code base[i1][i2]}. An index is named only when it is a literal, an identifier or
 * a member access on an identifier ({@code m[msg.sender]}).
 */
public final class CompositeNames {

    private CompositeNames() {}

    /** The most precise name for {@code node}, or null when it has none. */
    public static String preciseName(AstNode node) {
        return switch (node.type()) {
            case IDENTIFIER -> node.name().isEmpty() ? null : node.name();
            case MEMBER_ACCESS -> {
                String base = preciseName(node.get("expression"));
                yield base == null ? null : base + "." + node.string("memberName", "");
            }
            case INDEX_ACCESS -> {
                String base = preciseName(node.get("baseExpression"));
                String index = indexText(node.get("indexExpression"));
                yield base == null || index == null ? null : base + "[" + index + "]";
            }
            default -> null;
        };
    }

    /**
     * Every name a location is known by, coarsest first: {@code m[k1][k2]} yields
     * {@code m}, {@code m[k1]}, {@code m[k1][k2]}.
     */
    public static List<String> prefixNames(AstNode node) {
        List<String> names = new ArrayList<>();
        collectPrefixes(node, names);
        return names;
    }

    private static void collectPrefixes(AstNode node, List<String> names) {
        switch (node.type()) {
            case IDENTIFIER -> {
                if (!node.name().isEmpty()) names.add(node.name());
            }
            case MEMBER_ACCESS -> {
                collectPrefixes(node.get("expression"), names);
                String own = preciseName(node);
                if (own != null) names.add(own);
            }
            case INDEX_ACCESS -> {
                collectPrefixes(node.get("baseExpression"), names);
                String own = preciseName(node);
                if (own != null) names.add(own);
            }
            default -> { }
        }
    }

    static String indexText(AstNode index) {
        if (index.is(NodeType.LITERAL)) {
            return ExpressionText.literal(index);
        }
        if (index.is(NodeType.IDENTIFIER)) {
            return index.name();
        }
        if (index.is(NodeType.MEMBER_ACCESS) && index.get("expression").is(NodeType.IDENTIFIER)) {
            return index.get("expression").name() + "." + index.string("memberName", "");
        }
        return null;
    }

    /** The identifier a composite name is rooted at: {@code balances[msg.sender]} -> {@code balances}. */
    public static String rootOf(String name) {
        int cut = name.length();
        int dot = name.indexOf('.');
        int bracket = name.indexOf('[');
        if (dot >= 0) cut = Math.min(cut, dot);
        if (bracket >= 0) cut = Math.min(cut, bracket);
        return name.substring(0, cut);
    }
}
