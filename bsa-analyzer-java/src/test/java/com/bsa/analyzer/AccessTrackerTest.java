package com.bsa.analyzer;

import com.bsa.analyzer.access.AccessSet;
import com.bsa.analyzer.access.AccessTracker;
import com.bsa.analyzer.access.CompositeNames;
import com.bsa.analyzer.cfg.StatementClassifier;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.bsa.analyzer.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

class AccessTrackerTest {

    private static AccessSet accesses(JsonObject... statements) {
        return new AccessTracker().accessesOf(StatementClassifier.classify(nodes(statements)));
    }

    @Test
    void mappingWriteRecordsBaseAndCompositeName() {
        AccessSet a = accesses(assign(index(id("balances"), msgSender()), "=", num("0")));
        assertEquals(Set.of("balances", "balances[msg.sender]"), a.writes());
        assertEquals(Set.of("msg", "msg.sender"), a.reads());
    }

    @Test
    void nestedMappingWriteRecordsEveryPrefix() {
        AccessSet a = accesses(assign(index(index(id("allowed"), id("from")), id("to")), "=", id("v")));
        assertEquals(Set.of("allowed", "allowed[from]", "allowed[from][to]"), a.writes());
        assertEquals(Set.of("from", "to", "v"), a.reads());
    }

    @Test
    void memberWrite() {
        AccessSet a = accesses(assign(member(id("s"), "x"), "=", id("y")));
        assertEquals(Set.of("s", "s.x"), a.writes());
        assertEquals(Set.of("y"), a.reads());
    }

    @Test
    void mintEventReadsRecipientAndAmountButNotTheZeroAddress() {
        AccessSet a = accesses(emit("Transfer", cast("address", num("0")), id("to"), id("amount")));
        assertEquals(Set.of("amount", "to"), a.reads());
        assertTrue(a.writes().isEmpty());
    }

    @Test
    void burnEventReadsSenderAndAmountButNotTheZeroAddress() {
        AccessSet a = accesses(emit("Transfer", id("from"), cast("address", num("0")), id("amount")));
        assertEquals(Set.of("amount", "from"), a.reads());
        assertTrue(a.writes().isEmpty());
    }

    @Test
    void valueCallReadsOptionsAndReceiver() {
        AccessSet a = accesses(exprStmt(callWithValue(member(msgSender(), "call"), id("amount"), str(""))));
        assertEquals(Set.of("amount", "msg", "msg.sender"), a.reads());
        assertTrue(a.writes().isEmpty());
    }

    @Test
    void unexpandedForLoopCountsHeaderAndBodyCounters() {
        AccessSet a = accesses(forStmt(declare("i", num("0")), binary(id("i"), "<", id("n")),
                increment(id("i")), block(increment(id("count")))));
        assertEquals(Set.of("count", "i"), a.writes());
        assertEquals(Set.of("count", "i", "n"), a.reads());
    }

    @Test
    void declarationWritesEveryNamedSlot() {
        AccessSet a = accesses(declareAll(new String[]{"ok", null},
                callWithValue(member(msgSender(), "call"), id("amount"), str(""))));
        assertEquals(Set.of("ok"), a.writes());
        assertEquals(Set.of("amount", "msg", "msg.sender"), a.reads());
    }

    @Test
    void ifReadsOnlyItsCondition() {
        AccessSet a = accesses(ifStmt(binary(id("a"), ">", id("b")), block(assign("x", num("1"))), null));
        assertEquals(Set.of("a", "b"), a.reads());
        assertTrue(a.writes().isEmpty());
    }

    @Test
    void accessSetDropsEmptyAndCallShapedNames() {
        AccessSet a = AccessSet.of(Set.of("", "call(x)", "address(0)", "x"), Set.of("y"));
        assertEquals(Set.of("x"), a.reads());
        assertEquals(Set.of("y"), a.writes());
    }

    @Test
    void compositeNames() {
        JsonObject nested = index(index(id("m"), id("a")), member(id("msg"), "sender"));
        assertEquals(List.of("m", "m[a]", "m[a][msg.sender]"), CompositeNames.prefixNames(of(nested)));
        assertEquals("m[a][msg.sender]", CompositeNames.preciseName(of(nested)));
        assertNull(CompositeNames.preciseName(of(index(id("m"), binary(id("a"), "+", num("1"))))));
        assertEquals("balances", CompositeNames.rootOf("balances[msg.sender]"));
        assertEquals("s", CompositeNames.rootOf("s.x"));
        assertEquals("plain", CompositeNames.rootOf("plain"));
    }
}
