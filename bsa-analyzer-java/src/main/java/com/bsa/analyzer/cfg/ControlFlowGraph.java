package com.bsa.analyzer.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Index, predecessor and back-edge queries over an ordered block list.
 * Block order is creation order, which the analysis treats as execution order.
 */
public class ControlFlowGraph {

    private final List<BasicBlock> blocks;
    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, List<String>> predecessors = new LinkedHashMap<>();

    public ControlFlowGraph(List<BasicBlock> blocks) {
        this.blocks = blocks;
        for (int i = 0; i < blocks.size(); i++) {
            index.put(blocks.get(i).getId(), i);
            predecessors.put(blocks.get(i).getId(), new ArrayList<>());
        }
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            Terminator t = block.getTerminator();
            if (t.isPending()) {
                if (i + 1 < blocks.size()) addEdge(block.getId(), blocks.get(i + 1).getId());
                continue;
            }
            for (String target : t.successors()) {
                addEdge(block.getId(), target);
            }
        }
    }

    private void addEdge(String from, String to) {
        List<String> preds = predecessors.get(to);
        if (preds != null && !preds.contains(from)) {
            preds.add(from);
        }
    }

    public boolean contains(String id) { return index.containsKey(id); }

    public int indexOf(String id) { return index.getOrDefault(id, -1); }

    public BasicBlock block(String id) {
        Integer i = index.get(id);
        return i == null ? null : blocks.get(i);
    }

    public List<BasicBlock> blocks() { return blocks; }

    public List<String> predecessors(String id) {
        return predecessors.getOrDefault(id, List.of());
    }

    public List<String> successors(String id) {
        BasicBlock b = block(id);
        if (b == null) return List.of();
        if (b.getTerminator().isPending()) {
            int i = indexOf(id);
            return i + 1 < blocks.size() ? List.of(blocks.get(i + 1).getId()) : List.of();
        }
        return b.getTerminator().successors();
    }

    /** Blocks flagged as loop headers plus every target of a backward goto. */
    public Set<String> loopHeaders() {
        Set<String> headers = new LinkedHashSet<>();
        for (int i = 0; i < blocks.size(); i++) {
            BasicBlock block = blocks.get(i);
            if (block.isLoopHeader()) headers.add(block.getId());
            Terminator t = block.getTerminator();
            if (t.kind() == Terminator.Kind.GOTO && indexOf(t.target()) >= 0 && indexOf(t.target()) < i) {
                headers.add(t.target());
            }
        }
        return headers;
    }

    /** Ids reachable from {@code from} through one or more edges. */
    public Set<String> reachableFrom(String from) {
        Set<String> seen = new HashSet<>();
        Deque<String> work = new ArrayDeque<>(successors(from));
        while (!work.isEmpty()) {
            String id = work.pop();
            if (seen.add(id)) {
                work.addAll(successors(id));
            }
        }
        return seen;
    }
}
