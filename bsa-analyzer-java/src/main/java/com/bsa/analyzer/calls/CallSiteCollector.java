package com.bsa.analyzer.calls;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.NodeType;
import com.bsa.analyzer.ast.SourceMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the calls a function body makes, once per callee name in first-seen order.
 * Type conversions, event emissions and revert-family builtins are not calls here.
 */
public class CallSiteCollector {

    private final CallClassifier classifier;
    private final Map<String, AstNode> definitions;
    private final String sourceText;

    /**
     * @param definitions function definitions of the contract by name, for internal call locations
     */
    public CallSiteCollector(CallClassifier classifier, Map<String, AstNode> definitions, String sourceText) {
        this.classifier = classifier;
        this.definitions = definitions;
        this.sourceText = sourceText;
    }

    public List<CallSite> collect(AstNode body) {
        Map<String, CallSite> sites = new LinkedHashMap<>();
        walk(body, sites);
        return new ArrayList<>(sites.values());
    }

    private void walk(AstNode node, Map<String, CallSite> sites) {
        if (node.is(NodeType.EMIT_STATEMENT)) {
            // the event itself is not a call
            for (AstNode arg : node.get("eventCall").list("arguments")) walk(arg, sites);
            return;
        }
        if (node.is(NodeType.FUNCTION_CALL) && !CallClassifier.isTypeConversion(node)) {
            CallType type = classifier.classify(node);
            String name = CallClassifier.callName(node);
            if (type != CallType.REVERT && !sites.containsKey(name)) {
                AstNode at = type == CallType.INTERNAL && definitions.containsKey(name) ? definitions.get(name) : node;
                sites.put(name, new CallSite(name, type, SourceMapper.locate(at.src(), sourceText)));
            }
        }
        for (AstNode child : node.children()) {
            walk(child, sites);
        }
    }
}
