package com.bsa.analyzer.static_analysis;

import com.bsa.analyzer.ast.AstNode;
import com.bsa.analyzer.ast.NodeType;
import com.bsa.analyzer.ast.SourceLocation;
import com.bsa.analyzer.ast.SourceMapper;
import com.bsa.analyzer.calls.CallClassifier;
import com.bsa.analyzer.calls.CallSiteCollector;
import com.bsa.analyzer.calls.InlineTemplate;
import com.bsa.analyzer.calls.InternalCallInliner;
import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.ssa.SsaBlock;
import com.bsa.analyzer.static_analysis.ContractSummary.EventInfo;
import com.bsa.analyzer.static_analysis.ContractSummary.FunctionInfo;
import com.bsa.analyzer.static_analysis.ContractSummary.StateVariable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link ContractSummary} objects from a {@code SourceUnit}.
 */
public class ContractAssembler {

    public List<ContractSummary> assemble(AstNode sourceUnit, String sourceText) {
        String pragma = "";
        for (AstNode node : sourceUnit.list("nodes")) {
            if (node.is(NodeType.PRAGMA_DIRECTIVE)) {
                List<String> literals = node.strings("literals");
                if (!literals.isEmpty()) pragma = String.join(" ", literals);
            }
        }
        List<ContractSummary> contracts = new ArrayList<>();
        for (AstNode node : sourceUnit.list("nodes")) {
            if (node.is(NodeType.CONTRACT_DEFINITION)) {
                contracts.add(assembleContract(node, pragma, sourceText));
            }
        }
        return contracts;
    }

    public ContractSummary assembleContract(AstNode contract, String pragma, String sourceText) {
        // 1. Collect declarations
        List<StateVariable> stateVars = new ArrayList<>();
        Map<String, FunctionInfo> functions = new LinkedHashMap<>();
        Map<String, AstNode> definitions = new LinkedHashMap<>();
        List<EventInfo> events = new ArrayList<>();

        for (AstNode member : contract.list("nodes")) {
            switch (member.type()) {
                case VARIABLE_DECLARATION -> {
                    if (member.bool("stateVariable", false)) {
                        stateVars.add(new StateVariable(member.name(), typeName(member),
                                locate(member, sourceText)));
                    }
                }
                case FUNCTION_DEFINITION -> {
                    String name = functionName(member);
                    functions.put(name, new FunctionInfo(member.string("visibility", "internal"),
                            locate(member, sourceText)));
                    definitions.put(name, member);
                }
                case EVENT_DEFINITION -> events.add(new EventInfo(member.name(), locate(member, sourceText)));
                default -> { }
            }
        }

        // 2. Standalone pass over every function
        CallClassifier classifier = new CallClassifier(functions.keySet());
        FunctionProcessor processor = new FunctionProcessor(classifier);
        Map<String, FunctionProcessor.FirstPass> passes = new LinkedHashMap<>();
        Map<String, InlineTemplate> templates = new LinkedHashMap<>();
        for (Map.Entry<String, AstNode> e : definitions.entrySet()) {
            FunctionProcessor.FirstPass pass = processor.process(e.getValue());
            passes.put(e.getKey(), pass);
            templates.put(e.getKey(), InlineTemplate.of(e.getKey(),
                    FunctionProcessor.parameterNames(e.getValue()), pass.blocks()));
        }

        // 3. Entrypoints: inline internal calls and list call sites
        InternalCallInliner inliner = new InternalCallInliner(templates);
        CallSiteCollector callSites = new CallSiteCollector(classifier, definitions, sourceText);
        List<FunctionSummary> entrypoints = new ArrayList<>();
        for (Map.Entry<String, FunctionProcessor.FirstPass> e : passes.entrySet()) {
            FunctionInfo info = functions.get(e.getKey());
            if (!info.isEntrypoint()) continue;

            FunctionProcessor.FirstPass pass = e.getValue();
            List<BasicBlock> blocks = processor.inline(pass, inliner);
            entrypoints.add(new FunctionSummary(e.getKey(), info.visibility(), info.location(), pass.body(),
                    blocks, SsaBlock.strip(blocks), callSites.collect(pass.definition().get("body"))));
        }

        return new ContractSummary(contract.string("name", "Unknown"), pragma, locate(contract, sourceText),
                stateVars, functions, events, entrypoints);
    }

    /** Constructors, fallback and receive functions have no name; they are keyed by kind. */
    static String functionName(AstNode definition) {
        String name = definition.name();
        return name.isEmpty() ? definition.string("kind", "function") : name;
    }

    private static String typeName(AstNode declaration) {
        AstNode type = declaration.get("typeName");
        if (!type.isPresent()) return "";
        String name = type.string("name", "");
        if (!name.isEmpty()) return name;
        return type.get("typeDescriptions").string("typeString", "unknown");
    }

    private static SourceLocation locate(AstNode node, String sourceText) {
        return SourceMapper.locate(node.src(), sourceText);
    }
}
