package com.bsa.analyzer;

import com.bsa.analyzer.calls.CallClassifier;
import com.bsa.analyzer.calls.CallType;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.bsa.analyzer.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

class CallClassifierTest {

    private final CallClassifier classifier = new CallClassifier(Set.of("_credit", "withdraw"));

    private CallType classify(JsonObject call) {
        return classifier.classify(of(call));
    }

    @Test
    void revertFamily() {
        assertEquals(CallType.REVERT, classify(call("require", id("ok"))));
        assertEquals(CallType.REVERT, classify(call("assert", id("ok"))));
        assertEquals(CallType.REVERT, classify(call("revert")));
    }

    @Test
    void declaredFunctionsAreInternal() {
        assertEquals(CallType.INTERNAL, classify(call("_credit", id("to"))));
        assertEquals(CallType.INTERNAL, classify(call("withdraw")));
    }

    @Test
    void undeclaredIdentifiersAreExternal() {
        assertEquals(CallType.EXTERNAL, classify(call("keccak256", id("data"))));
    }

    @Test
    void lowLevelMembers() {
        assertEquals(CallType.LOW_LEVEL_EXTERNAL, classify(call(member(msgSender(), "call"), str(""))));
        assertEquals(CallType.LOW_LEVEL_EXTERNAL, classify(call(member(id("to"), "send"), id("v"))));
        assertEquals(CallType.LOW_LEVEL_EXTERNAL, classify(call(member(id("to"), "transfer"), id("v"))));
        assertEquals(CallType.DELEGATECALL, classify(call(member(id("impl"), "delegatecall"), id("data"))));
        assertEquals(CallType.STATICCALL, classify(call(member(id("impl"), "staticcall"), id("data"))));
    }

    @Test
    void valueOptionsAreLookedThrough() {
        JsonObject call = callWithValue(member(msgSender(), "call"), id("amount"), str(""));
        assertEquals(CallType.LOW_LEVEL_EXTERNAL, classify(call));
        assertEquals("msg.sender.call", CallClassifier.callName(of(call)));
    }

    @Test
    void contractTypedReceiversAreExternal() {
        assertEquals(CallType.EXTERNAL,
                classify(call(member(typedId("token", "contract IERC20"), "balanceOf"), id("who"))));
        assertEquals(CallType.EXTERNAL,
                classify(call(member(contractCast("IERC20", id("token")), "approve"), id("spender"))));
    }

    @Test
    void typeConversions() {
        assertTrue(CallClassifier.isTypeConversion(of(cast("uint256", id("x")))));
        assertTrue(CallClassifier.isTypeConversion(of(contractCast("IERC20", id("token")))));
        assertFalse(CallClassifier.isTypeConversion(of(call("foo"))));
    }

    @Test
    void externalFamily() {
        assertTrue(CallType.EXTERNAL.isExternalFamily());
        assertTrue(CallType.DELEGATECALL.isExternalFamily());
        assertFalse(CallType.INTERNAL.isExternalFamily());
        assertFalse(CallType.REVERT.isExternalFamily());
        assertEquals("low_level_external", CallType.LOW_LEVEL_EXTERNAL.tag());
    }
}
