package com.bsa.analyzer;

import com.bsa.analyzer.calls.CallClassifier;
import com.bsa.analyzer.cfg.BasicBlock;
import com.bsa.analyzer.ssa.Instruction;
import com.bsa.analyzer.ssa.Opcode;
import com.bsa.analyzer.static_analysis.FunctionProcessor;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.bsa.analyzer.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

class SsaConverterTest {

    static List<BasicBlock> process(Set<String> functions, JsonObject... statements) {
        FunctionProcessor processor = new FunctionProcessor(new CallClassifier(functions));
        return processor.process(of(function("f", "external", List.of(), statements))).blocks();
    }

    static List<String> rendered(List<BasicBlock> blocks) {
        List<String> out = new ArrayList<>();
        for (BasicBlock b : blocks) {
            for (Instruction i : b.getInstructions()) out.add(i.render());
        }
        return out;
    }

    private static List<String> lower(JsonObject... statements) {
        return rendered(process(Set.of(), statements));
    }

    @Test
    void everyWriteGetsAFreshVersion() {
        assertEquals(List.of("x_1 = 1", "x_2 = x_1", "y_1 = x_2"),
                lower(assign("x", num("1")), assign("x", binary(id("x"), "+", num("1"))), assign("y", id("x"))));
    }

    @Test
    void compoundAssignmentKeepsItsBase() {
        assertEquals(List.of("total_1 = total_0 + amount_0"),
                lower(assign(id("total"), "+=", id("amount"))));
    }

    @Test
    void incrementIsACompoundAssignment() {
        assertEquals(List.of("count_1 = count_0 + 1"), lower(increment(id("count"))));
    }

    @Test
    void mappingWriteIsVersionedByCompositeName() {
        List<BasicBlock> blocks = process(Set.of(), assign(index(id("balances"), msgSender()), "=", num("0")));
        assertEquals(List.of("balances[msg.sender]_1 = 0"), rendered(blocks));
        assertEquals(1, blocks.get(0).getWriteVersions().get("balances"));
        assertEquals(1, blocks.get(0).getWriteVersions().get("balances[msg.sender]"));
    }

    @Test
    void callStatementsGetResultSlots() {
        assertEquals(List.of("ret_1 = call[external](foo, a_0)", "ret_2 = call[external](bar)"),
                lower(callStmt("foo", id("a")), callStmt("bar")));
    }

    @Test
    void internalCallsAreTagged() {
        assertEquals(List.of("ret_1 = call[internal](_helper, 5)"),
                rendered(process(Set.of("_helper"), callStmt("_helper", num("5")))));
    }

    @Test
    void revertFamilyHasNoResultSlot() {
        List<BasicBlock> blocks = process(Set.of(), callStmt("require", id("ok")));
        assertEquals(List.of("call[revert](require, ok_0)"), rendered(blocks));
        Instruction call = blocks.get(0).getInstructions().get(0);
        assertTrue(call.isCall());
        assertFalse(call.isExternalCall());
    }

    @Test
    void lowLevelCallInTupleDeclaration() {
        List<BasicBlock> blocks = process(Set.of(), declareAll(new String[]{"ok", null},
                callWithValue(member(msgSender(), "call"), id("amount"), str(""))));
        assertEquals(List.of("ok_1 = call[low_level_external](msg.sender.call, \"\")"), rendered(blocks));
        assertTrue(blocks.get(0).getInstructions().get(0).isExternalCall());
    }

    @Test
    void declarationWithoutValueIsDefault() {
        assertEquals(List.of("z_1 = default"), lower(declare("z", null)));
    }

    @Test
    void declarationReadsItsInitialiser() {
        assertEquals(List.of("amount_1 = balances[msg.sender]_0"),
                lower(declare("amount", index(id("balances"), msgSender()))));
    }

    @Test
    void conditionKeepsTheLeftOperand() {
        List<String> out = lower(ifStmt(binary(id("amount"), ">", num("0")), block(), null));
        assertEquals("if (amount_0)", out.get(0));
    }

    @Test
    void emitListsEveryArgument() {
        assertEquals(List.of("emit Deposit(msg.sender_0, amount_0)"),
                lower(emit("Deposit", msgSender(), id("amount"))));
    }

    @Test
    void returnListsTheVariablesItReads() {
        assertEquals(List.of("x_1 = 1", "return x_1 y_0"),
                lower(assign("x", num("1")), ret(binary(id("x"), "+", id("y")))));
    }

    @Test
    void typeConversionStatementIsNotACall() {
        List<BasicBlock> blocks = process(Set.of(), exprStmt(cast("uint256", id("x"))));
        Instruction only = blocks.get(0).getInstructions().get(0);
        assertEquals(Opcode.EXPRESSION, only.opcode());
        assertEquals("x_0", only.render());
    }

    @Test
    void readVersionsAreTheVersionsOnEntry() {
        List<BasicBlock> blocks = process(Set.of(), assign("x", num("1")), assign("y", id("x")));
        assertEquals(1, blocks.get(1).getReadVersions().get("x"));
        assertEquals(1, blocks.get(1).getWriteVersions().get("y"));
    }
}
