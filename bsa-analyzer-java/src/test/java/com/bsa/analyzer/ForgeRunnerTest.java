package com.bsa.analyzer;

import com.bsa.analyzer.build.ForgeRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ForgeRunnerTest {

    @Test
    void nonExistentProjectRootFails(@TempDir Path tmp) {
        ForgeRunner runner = new ForgeRunner("forge");
        assertFalse(runner.prepare(tmp.resolve("does-not-exist")));
    }

    @Test
    void missingForgeExecutableFails(@TempDir Path tmp) {
        ForgeRunner runner = new ForgeRunner("bsa-test-no-such-forge-binary");
        assertFalse(runner.prepare(tmp));
    }
}
