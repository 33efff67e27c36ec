package com.bsa.analyzer.calls;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.ExpressionText;
import com.bsa.analyzer.ast.NodeType;

import java.util.Set;

/**
 * Classifies {@code FunctionCall} nodes against the functions declared by the enclosing contract.
 */
public class CallClassifier {

    private static final Set<String> REVERT_FAMILY = Set.of("revert", "require", "assert");
    private static final Set<String> LOW_LEVEL = Set.of("call", "send", "transfer");

    private final Set<String> functionNames;

    public CallClassifier(Set<String> functionNames) {
        this.functionNames = Set.copyOf(functionNames);
    }

    public CallType classify(AstNode call) {
        AstNode callee = calleeOf(call);
        if (callee.is(NodeType.IDENTIFIER)) {
            String name = callee.name();
            if (REVERT_FAMILY.contains(name)) return CallType.REVERT;
            return functionNames.contains(name) ? CallType.INTERNAL : CallType.EXTERNAL;
        }
        if (callee.is(NodeType.MEMBER_ACCESS)) {
            String member = callee.string("memberName", "");
            if (LOW_LEVEL.contains(member)) return CallType.LOW_LEVEL_EXTERNAL;
            if (member.equals("delegatecall")) return CallType.DELEGATECALL;
            if (member.equals("staticcall")) return CallType.STATICCALL;

            AstNode receiver = callee.get("expression");
            if (receiver.is(NodeType.FUNCTION_CALL) && isTypeConversion(receiver)) {
                return CallType.EXTERNAL;
            }
            if (receiver.is(NodeType.IDENTIFIER)) {
                String type = typeString(receiver).toLowerCase();
                if (type.contains("contract") || type.contains("interface")) return CallType.EXTERNAL;
                if (functionNames.contains(receiver.name())) return CallType.INTERNAL;
            }
        }
        return CallType.EXTERNAL;
    }

    /** Name used in rendered calls and call listings: the identifier, or the member path. */
    public static String callName(AstNode call) {
        AstNode callee = calleeOf(call);
        if (callee.is(NodeType.IDENTIFIER)) return callee.name();
        return ExpressionText.of(callee);
    }

    /** The callee with any {@code {value: ..., gas: ...}} wrapper removed. */
    public static AstNode calleeOf(AstNode call) {
        AstNode callee = call.get("expression");
        while (callee.is(NodeType.FUNCTION_CALL_OPTIONS)) {
            callee = callee.get("expression");
        }
        return callee;
    }

    /** {@code uint256(x)}, {@code address(this)}, {@code IERC20(token)}. */
    public static boolean isTypeConversion(AstNode call) {
        return "typeConversion".equals(call.string("kind", ""))
                || calleeOf(call).is(NodeType.ELEMENTARY_TYPE_NAME_EXPRESSION);
    }

    private static String typeString(AstNode node) {
        return node.get("typeDescriptions").string("typeString", "");
    }
}
