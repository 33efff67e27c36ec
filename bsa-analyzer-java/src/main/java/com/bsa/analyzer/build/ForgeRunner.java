package com.bsa.analyzer.build;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Produces the compiler AST artifacts of a Foundry project ({@code clean}, then {@code build --ast}).
 */
public class ForgeRunner {

    public static class BuildException extends RuntimeException {
        public BuildException(String msg) { super(msg); }
        public BuildException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final String forgeCommand;

    public ForgeRunner(String forgeCommand) {
        this.forgeCommand = forgeCommand;
    }

    /**
     * Cleans and rebuilds the project at {@code projectRoot}. Failures are logged, never thrown.
     *
     * @return true when both steps succeeded
     */
    public boolean prepare(Path projectRoot) {
        if (!Files.isDirectory(projectRoot)) {
            System.err.println("[bsa] Project root does not exist or is not a directory: " + projectRoot);
            return false;
        }
        try {
            runCommand(List.of(forgeCommand, "clean"), projectRoot);
            runCommand(List.of(forgeCommand, "build", "--ast"), projectRoot);
            return true;
        } catch (BuildException e) {
            System.err.println("[bsa] Build failed: " + e.getMessage());
            return false;
        }
    }

    void runCommand(List<String> command, Path workDir) {
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true);

        StringBuilder output = new StringBuilder();
        try {
            Process process = pb.start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                    System.err.println("[bsa] BUILD: " + line);
                }
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new BuildException(String.join(" ", command) + " failed (exit " + exitCode + "):\n" + output);
            }
        } catch (IOException e) {
            throw new BuildException("Failed to spawn " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildException("Build interrupted", e);
        }
    }
}
