package com.bsa.analyzer.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Compact source-like text for an expression, used for call names and fallback operands.
 */
public final class ExpressionText {

    private ExpressionText() {}

    public static String of(AstNode node) {
        return switch (node.type()) {
            case IDENTIFIER -> node.name();
            case MEMBER_ACCESS -> of(node.get("expression")) + "." + node.string("memberName", "");
            case INDEX_ACCESS -> of(node.get("baseExpression")) + "[" + of(node.get("indexExpression")) + "]";
            case FUNCTION_CALL_OPTIONS -> of(node.get("expression"));
            case FUNCTION_CALL -> of(node.get("expression")) + "(" + join(node.list("arguments")) + ")";
            case LITERAL -> literal(node);
            case BINARY_OPERATION -> of(node.get("leftExpression")) + " " + node.string("operator", "?")
                    + " " + of(node.get("rightExpression"));
            case UNARY_OPERATION -> {
                String op = node.string("operator", "");
                String sub = of(node.get("subExpression"));
                yield node.bool("prefix", false) ? op + sub : sub + op;
            }
            case ELEMENTARY_TYPE_NAME_EXPRESSION -> {
                AstNode typeName = node.get("typeName");
                yield typeName.isPresent() ? typeName.string("name", "") : node.string("typeName", "");
            }
            case TUPLE_EXPRESSION -> "(" + join(node.list("components")) + ")";
            default -> node.name();
        };
    }

    /** String literals are quoted; everything else is the literal value verbatim. */
    public static String literal(AstNode literal) {
        String value = literal.string("value", literal.string("hexValue", ""));
        if ("string".equals(literal.string("kind", ""))) {
            return "\"" + value + "\"";
        }
        return value;
    }

    private static String join(List<AstNode> nodes) {
        List<String> parts = new ArrayList<>(nodes.size());
        for (AstNode n : nodes) parts.add(of(n));
        return String.join(", ", parts);
    }
}
