package com.bsa.analyzer.cfg;

import com.bsa.analyzer.access.AccessSet;
import com.bsa.analyzer.ssa.Instruction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One node of a function's control-flow graph, carried through every pipeline stage:
 * statements and terminator from the CFG passes, accesses from the tracker, versions and
 * instructions from the SSA converter.
 */
public class BasicBlock {

    private final String id;
    private final List<TypedStatement> statements;
    private Terminator terminator = Terminator.PENDING;
    private LoopRole role;
    private BranchSide branchSide;
    private AccessSet accesses = AccessSet.empty();
    private final Map<String, Integer> readVersions = new TreeMap<>();
    private final Map<String, Integer> writeVersions = new TreeMap<>();
    private List<Instruction> instructions = new ArrayList<>();
    private final Set<String> loopCarried = new TreeSet<>();

    public BasicBlock(String id, List<TypedStatement> statements) {
        this.id = id;
        this.statements = new ArrayList<>(statements);
    }

    public String getId() { return id; }
    public List<TypedStatement> getStatements() { return statements; }

    public Terminator getTerminator() { return terminator; }
    public void setTerminator(Terminator terminator) { this.terminator = terminator; }

    public LoopRole getRole() { return role; }
    public void setRole(LoopRole role) { this.role = role; }

    public BranchSide getBranchSide() { return branchSide; }
    public void setBranchSide(BranchSide branchSide) { this.branchSide = branchSide; }

    public AccessSet getAccesses() { return accesses; }
    public void setAccesses(AccessSet accesses) { this.accesses = accesses; }

    /** Version each read variable has on entry to this block. */
    public Map<String, Integer> getReadVersions() { return readVersions; }

    /** Version each written variable has on exit from this block. */
    public Map<String, Integer> getWriteVersions() { return writeVersions; }

    public List<Instruction> getInstructions() { return instructions; }
    public void setInstructions(List<Instruction> instructions) { this.instructions = new ArrayList<>(instructions); }

    /** Variables that must be merged at this loop header because the loop body calls out. */
    public Set<String> getLoopCarried() { return loopCarried; }

    public boolean contains(StatementKind kind) {
        for (TypedStatement s : statements) {
            if (s.kind() == kind) return true;
        }
        return false;
    }

    public boolean isLoopHeader() { return role == LoopRole.HEADER; }

    /** A copy with the same id and independent mutable state. */
    public BasicBlock copy() {
        return copyAs(id);
    }

    public BasicBlock copyAs(String newId) {
        BasicBlock b = new BasicBlock(newId, statements);
        b.terminator = terminator;
        b.role = role;
        b.branchSide = branchSide;
        b.accesses = accesses;
        b.readVersions.putAll(readVersions);
        b.writeVersions.putAll(writeVersions);
        b.instructions = new ArrayList<>(instructions);
        b.loopCarried.addAll(loopCarried);
        return b;
    }

    @Override
    public String toString() {
        return id + " " + statements + " -> " + terminator.render();
    }
}
