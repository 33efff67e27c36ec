package com.bsa.analyzer;

import com.bsa.analyzer.ir.AnalysisSerializer;
import com.bsa.analyzer.ssa.SsaBlock;
import com.bsa.analyzer.static_analysis.ContractSummary;
import com.bsa.analyzer.static_analysis.FunctionSummary;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VaultProjectTest {

    static final Path VAULT = Paths.get(
            System.getProperty("user.dir"),
            "..", "test-fixtures", "vault-project").normalize();

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();

    private List<ContractSummary> run(String... flags) {
        List<String> args = new ArrayList<>();
        args.add(VAULT.toString());
        args.add("--skip-build");
        args.addAll(List.of(flags));
        return AnalyzerMain.run(args.toArray(new String[0]), new PrintStream(buf, true, StandardCharsets.UTF_8));
    }

    private List<String> lines() {
        return buf.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private static FunctionSummary entrypoint(ContractSummary c, String name) {
        for (FunctionSummary fn : c.entrypoints()) {
            if (fn.name().equals(name)) return fn;
        }
        throw new AssertionError("no entrypoint " + name);
    }

    private static List<String> statements(FunctionSummary fn) {
        List<String> out = new ArrayList<>();
        for (SsaBlock b : fn.ssa()) out.addAll(b.statements());
        return out;
    }

    @Test
    void contractShape() {
        List<ContractSummary> contracts = run();
        assertEquals(1, contracts.size());
        ContractSummary vault = contracts.get(0);
        assertEquals("Vault", vault.name());
        assertEquals(List.of("balances", "totalDeposits"), List.copyOf(vault.stateVarNames()));
        assertEquals(List.of("deposit", "withdraw", "safeWithdraw", "_credit"), List.copyOf(vault.functions().keySet()));
        assertEquals(2, vault.events().size());
        assertEquals(3, vault.entrypoints().size());
        assertEquals("mapping(address => uint256)", vault.stateVars().get(0).type());
        assertEquals(5, vault.stateVars().get(0).location().line());
    }

    @Test
    void withdrawIsReentrant() {
        run();
        List<String> lines = lines();
        assertTrue(lines.contains("!!!! REENTRANCY found in Vault.withdraw"), String.join("\n", lines));
        assertTrue(lines.contains("     Description: External call detected before state variable write "
                + "(balances[msg.sender]_1 = 0 at Block4)"));
        assertTrue(lines.contains("     Severity: High"));
        assertFalse(lines.contains("!!!! REENTRANCY found in Vault.safeWithdraw"));
        assertFalse(lines.contains("!!!! REENTRANCY found in Vault.deposit"));
    }

    @Test
    void reachabilityModeAgreesOnStraightLineCode() {
        run("--mode", "reachability");
        List<String> lines = lines();
        assertTrue(lines.contains("!!!! REENTRANCY found in Vault.withdraw"));
        assertFalse(lines.contains("!!!! REENTRANCY found in Vault.safeWithdraw"));
    }

    @Test
    void withdrawBlocksAndCalls() {
        FunctionSummary withdraw = entrypoint(run().get(0), "withdraw");
        assertEquals(7, withdraw.ssa().size());
        assertEquals(List.of(
                "amount_1 = balances[msg.sender]_0",
                "call[revert](require, amount_1, \"nothing to withdraw\")",
                "ok_1 = call[low_level_external](msg.sender.call, \"\")",
                "call[revert](require, ok_1, \"transfer failed\")",
                "balances[msg.sender]_1 = 0",
                "totalDeposits_1 = totalDeposits_0 - amount_1",
                "emit Withdrawn(msg.sender_0, amount_1)"), statements(withdraw));

        List<String> lines = lines();
        int at = lines.indexOf("Entrypoint: withdraw at line 16, col 5");
        assertTrue(at >= 0);
        assertEquals("  Blocks: 7", lines.get(at + 1));
        assertTrue(lines.contains("  External calls: msg.sender.call (unknown) at line 19, col 23"));
    }

    @Test
    void depositInlinesCredit() {
        FunctionSummary deposit = entrypoint(run().get(0), "deposit");
        assertEquals(List.of(
                "ret_1 = call[internal](_credit, msg.sender_0, msg.value_0)",
                "balances[msg.sender]_1 = balances[msg.sender]_0 + msg.value_0",
                "totalDeposits_1 = totalDeposits_0 + msg.value_0",
                "emit Deposited(msg.sender_0, msg.value_0)"), statements(deposit));
        assertEquals(List.of("Block0", "Block2", "Block3", "Block1"),
                deposit.ssa().stream().map(SsaBlock::id).toList());

        List<String> lines = lines();
        int at = lines.indexOf("Entrypoint: deposit at line 11, col 5");
        assertTrue(at >= 0);
        assertEquals("  Blocks: 4", lines.get(at + 1));
        assertTrue(lines.contains("  Internal calls: _credit (this contract) at line 36, col 5"));
    }

    @Test
    void exportIsStableAcrossRuns(@TempDir Path tmp) throws IOException {
        Path first = tmp.resolve("first");
        Path second = tmp.resolve("second");
        run("--output", first.toString());
        run("--output", second.toString());

        String a = Files.readString(first.resolve(AnalysisSerializer.FILE_NAME));
        String b = Files.readString(second.resolve(AnalysisSerializer.FILE_NAME));
        assertEquals(a, b);
        assertTrue(a.endsWith("\n"));

        JsonObject root = JsonParser.parseString(a).getAsJsonObject();
        assertEquals("0.1.0", root.get("tool_version").getAsString());
        assertEquals("vault-project", root.get("project").getAsString());
        JsonObject vault = root.getAsJsonArray("contracts").get(0).getAsJsonObject();
        assertEquals("Vault", vault.get("name").getAsString());
        assertEquals("withdraw", vault.getAsJsonArray("findings").get(0).getAsJsonObject().get("function").getAsString());
        assertEquals("external", vault.getAsJsonObject("functions").getAsJsonObject("deposit")
                .get("visibility").getAsString());

        JsonObject withdraw = vault.getAsJsonArray("entrypoints").get(1).getAsJsonObject();
        JsonObject call = withdraw.getAsJsonArray("calls").get(0).getAsJsonObject();
        assertEquals("low_level_external", call.get("call_type").getAsString());
        assertTrue(call.get("is_external").getAsBoolean());
        assertFalse(call.get("in_contract").getAsBoolean());
        JsonArray location = call.getAsJsonArray("location");
        assertEquals(19, location.get(0).getAsInt());
        assertEquals(23, location.get(1).getAsInt());
        assertEquals("goto Block1", withdraw.getAsJsonArray("ssa").get(0).getAsJsonObject()
                .get("terminator").getAsString());
    }
}
