package com.bsa.analyzer;

import com.bsa.analyzer.ast.AstNode;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds compiler-shaped AST JSON in memory for tests.
 */
final class Ast {

    private Ast() {}

    static JsonObject node(String nodeType) {
        JsonObject o = new JsonObject();
        o.addProperty("nodeType", nodeType);
        o.addProperty("src", "0:0:0");
        return o;
    }

    static JsonArray array(JsonObject... items) {
        JsonArray a = new JsonArray();
        for (JsonObject i : items) a.add(i == null ? JsonNull.INSTANCE : i);
        return a;
    }

    static AstNode of(JsonObject o) {
        return AstNode.of(o);
    }

    static List<AstNode> nodes(JsonObject... statements) {
        List<AstNode> out = new ArrayList<>();
        for (JsonObject s : statements) out.add(AstNode.of(s));
        return out;
    }

    // expressions

    static JsonObject id(String name) {
        JsonObject o = node("Identifier");
        o.addProperty("name", name);
        return o;
    }

    static JsonObject typedId(String name, String typeString) {
        JsonObject o = id(name);
        JsonObject type = new JsonObject();
        type.addProperty("typeString", typeString);
        o.add("typeDescriptions", type);
        return o;
    }

    static JsonObject num(String value) {
        JsonObject o = node("Literal");
        o.addProperty("kind", "number");
        o.addProperty("value", value);
        return o;
    }

    static JsonObject str(String value) {
        JsonObject o = node("Literal");
        o.addProperty("kind", "string");
        o.addProperty("value", value);
        return o;
    }

    static JsonObject member(JsonObject base, String memberName) {
        JsonObject o = node("MemberAccess");
        o.add("expression", base);
        o.addProperty("memberName", memberName);
        return o;
    }

    static JsonObject msgSender() {
        return member(id("msg"), "sender");
    }

    static JsonObject index(JsonObject base, JsonObject index) {
        JsonObject o = node("IndexAccess");
        o.add("baseExpression", base);
        o.add("indexExpression", index);
        return o;
    }

    static JsonObject binary(JsonObject left, String operator, JsonObject right) {
        JsonObject o = node("BinaryOperation");
        o.add("leftExpression", left);
        o.addProperty("operator", operator);
        o.add("rightExpression", right);
        return o;
    }

    static JsonObject call(JsonObject callee, JsonObject... args) {
        JsonObject o = node("FunctionCall");
        o.addProperty("kind", "functionCall");
        o.add("expression", callee);
        o.add("arguments", array(args));
        return o;
    }

    static JsonObject call(String callee, JsonObject... args) {
        return call(id(callee), args);
    }

    /** {@code callee{value: value}(args)} */
    static JsonObject callWithValue(JsonObject callee, JsonObject value, JsonObject... args) {
        JsonObject options = node("FunctionCallOptions");
        options.add("expression", callee);
        JsonArray names = new JsonArray();
        names.add("value");
        options.add("names", names);
        options.add("options", array(value));
        return call(options, args);
    }

    /** {@code type(arg)}, e.g. {@code address(0)}. */
    static JsonObject cast(String type, JsonObject arg) {
        JsonObject typeExpr = node("ElementaryTypeNameExpression");
        JsonObject typeName = node("ElementaryTypeName");
        typeName.addProperty("name", type);
        typeExpr.add("typeName", typeName);
        JsonObject o = call(typeExpr, arg);
        o.addProperty("kind", "typeConversion");
        return o;
    }

    /** {@code Contract(arg)} conversion to a contract or interface type. */
    static JsonObject contractCast(String contract, JsonObject arg) {
        JsonObject o = call(id(contract), arg);
        o.addProperty("kind", "typeConversion");
        return o;
    }

    // statements

    static JsonObject exprStmt(JsonObject expression) {
        JsonObject o = node("ExpressionStatement");
        o.add("expression", expression);
        return o;
    }

    static JsonObject assign(JsonObject lhs, String operator, JsonObject rhs) {
        JsonObject a = node("Assignment");
        a.add("leftHandSide", lhs);
        a.addProperty("operator", operator);
        a.add("rightHandSide", rhs);
        return exprStmt(a);
    }

    static JsonObject assign(String lhs, JsonObject rhs) {
        return assign(id(lhs), "=", rhs);
    }

    static JsonObject callStmt(String callee, JsonObject... args) {
        return exprStmt(call(callee, args));
    }

    static JsonObject increment(JsonObject target) {
        JsonObject u = node("UnaryOperation");
        u.addProperty("operator", "++");
        u.addProperty("prefix", false);
        u.add("subExpression", target);
        return exprStmt(u);
    }

    static JsonObject declare(String name, JsonObject initialValue) {
        return declareAll(new String[]{name}, initialValue);
    }

    /** Tuple declaration; a null name leaves an empty slot, as in {@code (bool ok, ) = ...}. */
    static JsonObject declareAll(String[] names, JsonObject initialValue) {
        JsonObject o = node("VariableDeclarationStatement");
        JsonArray decls = new JsonArray();
        for (String n : names) {
            if (n == null) {
                decls.add(JsonNull.INSTANCE);
                continue;
            }
            JsonObject d = node("VariableDeclaration");
            d.addProperty("name", n);
            decls.add(d);
        }
        o.add("declarations", decls);
        if (initialValue != null) o.add("initialValue", initialValue);
        return o;
    }

    static JsonObject block(JsonObject... statements) {
        JsonObject o = node("Block");
        o.add("statements", array(statements));
        return o;
    }

    static JsonObject ifStmt(JsonObject condition, JsonObject trueBody, JsonObject falseBody) {
        JsonObject o = node("IfStatement");
        o.add("condition", condition);
        o.add("trueBody", trueBody);
        if (falseBody != null) o.add("falseBody", falseBody);
        return o;
    }

    static JsonObject forStmt(JsonObject init, JsonObject condition, JsonObject step, JsonObject body) {
        JsonObject o = node("ForStatement");
        o.add("initializationExpression", init);
        o.add("condition", condition);
        o.add("loopExpression", step);
        o.add("body", body);
        return o;
    }

    static JsonObject whileStmt(JsonObject condition, JsonObject body) {
        JsonObject o = node("WhileStatement");
        o.add("condition", condition);
        o.add("body", body);
        return o;
    }

    static JsonObject ret(JsonObject expression) {
        JsonObject o = node("Return");
        if (expression != null) o.add("expression", expression);
        return o;
    }

    static JsonObject emit(String event, JsonObject... args) {
        JsonObject o = node("EmitStatement");
        o.add("eventCall", call(event, args));
        return o;
    }

    // declarations

    static JsonObject function(String name, String visibility, List<String> params, JsonObject... statements) {
        JsonObject o = node("FunctionDefinition");
        o.addProperty("name", name);
        o.addProperty("kind", "function");
        o.addProperty("visibility", visibility);
        JsonObject parameters = node("ParameterList");
        JsonArray list = new JsonArray();
        for (String p : params) {
            JsonObject d = node("VariableDeclaration");
            d.addProperty("name", p);
            list.add(d);
        }
        parameters.add("parameters", list);
        o.add("parameters", parameters);
        o.add("body", block(statements));
        return o;
    }

    static JsonObject stateVar(String name, String type) {
        JsonObject o = node("VariableDeclaration");
        o.addProperty("name", name);
        o.addProperty("stateVariable", true);
        JsonObject typeName = node("ElementaryTypeName");
        typeName.addProperty("name", type);
        o.add("typeName", typeName);
        return o;
    }

    static JsonObject event(String name) {
        JsonObject o = node("EventDefinition");
        o.addProperty("name", name);
        return o;
    }

    static JsonObject contract(String name, JsonObject... members) {
        JsonObject o = node("ContractDefinition");
        o.addProperty("name", name);
        o.add("nodes", array(members));
        return o;
    }

    static JsonObject sourceUnit(JsonObject... contracts) {
        JsonObject pragma = node("PragmaDirective");
        JsonArray literals = new JsonArray();
        for (String l : new String[]{"solidity", "^", "0.8", ".20"}) literals.add(l);
        pragma.add("literals", literals);
        JsonObject o = node("SourceUnit");
        JsonArray nodes = new JsonArray();
        nodes.add(pragma);
        for (JsonElement c : contracts) nodes.add(c);
        o.add("nodes", nodes);
        return o;
    }
}
