package com.bsa.analyzer;

import com.bsa.analyzer.ast.SourceLocation;
import com.bsa.analyzer.calls.CallClassifier;
import com.bsa.analyzer.calls.CallSite;
import com.bsa.analyzer.calls.CallSiteCollector;
import com.bsa.analyzer.calls.CallType;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.bsa.analyzer.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

class CallSiteCollectorTest {

    @Test
    void listsEachCalleeOnceSkippingRevertsEventsAndConversions() {
        JsonObject body = block(
                callStmt("_credit", id("a")),
                exprStmt(callWithValue(member(msgSender(), "call"), id("amount"), str(""))),
                callStmt("require", id("ok")),
                emit("Sent", cast("uint256", id("x"))),
                callStmt("_credit", id("b")));
        CallSiteCollector collector = new CallSiteCollector(new CallClassifier(Set.of("_credit")), Map.of(), "");

        List<CallSite> calls = collector.collect(of(body));
        assertEquals(2, calls.size());
        assertEquals("_credit", calls.get(0).name());
        assertEquals(CallType.INTERNAL, calls.get(0).callType());
        assertTrue(calls.get(0).inContract());
        assertFalse(calls.get(0).isExternal());
        assertEquals("msg.sender.call", calls.get(1).name());
        assertEquals(CallType.LOW_LEVEL_EXTERNAL, calls.get(1).callType());
        assertTrue(calls.get(1).isExternal());
    }

    @Test
    void nestedCallsAreFoundOuterFirst() {
        JsonObject body = block(callStmt("outer", call("inner", id("x"))));
        List<CallSite> calls = new CallSiteCollector(new CallClassifier(Set.of()), Map.of(), "").collect(of(body));
        assertEquals(List.of("outer", "inner"), List.of(calls.get(0).name(), calls.get(1).name()));
    }

    @Test
    void callsInsideBranchesAndLoopsAreFound() {
        JsonObject body = block(
                ifStmt(id("c"), block(callStmt("a")), block(callStmt("b"))),
                whileStmt(id("d"), block(callStmt("c"))));
        List<CallSite> calls = new CallSiteCollector(new CallClassifier(Set.of()), Map.of(), "").collect(of(body));
        assertEquals(3, calls.size());
    }

    @Test
    void internalCallsPointAtTheCalleeDefinition() {
        JsonObject definition = function("_credit", "internal", List.of());
        definition.addProperty("src", "4:10:0");
        JsonObject callNode = call("_credit");
        callNode.addProperty("src", "0:9:0");

        CallSiteCollector collector = new CallSiteCollector(new CallClassifier(Set.of("_credit")),
                Map.of("_credit", of(definition)), "abc\ndef");
        List<CallSite> calls = collector.collect(of(block(exprStmt(callNode))));
        assertEquals(new SourceLocation(2, 1), calls.get(0).location());
    }

    @Test
    void noCalls() {
        List<CallSite> calls = new CallSiteCollector(new CallClassifier(Set.of()), Map.of(), "")
                .collect(of(block(assign("x", num("1")))));
        assertTrue(calls.isEmpty());
    }
}
