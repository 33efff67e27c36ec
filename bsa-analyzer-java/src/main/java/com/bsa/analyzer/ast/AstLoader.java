package com.bsa.analyzer.ast;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a compiler AST artifact ({@code out/<Name>.sol/<Name>.json}).
 */
public class AstLoader {

    public static class AstLoadException extends RuntimeException {
        public AstLoadException(String message) { super(message); }
        public AstLoadException(String message, Throwable cause) { super(message, cause); }
    }

    /**
     * Reads the artifact and returns its top-level object.
     *
     * @throws AstLoadException if the file is missing, empty or not a JSON object
     */
    public AstNode load(Path artifact) {
        if (!Files.isRegularFile(artifact)) {
            throw new AstLoadException("AST file not found: " + artifact);
        }
        try (Reader reader = new FileReader(artifact.toFile(), StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            if (root == null || !root.isJsonObject()) {
                throw new AstLoadException("AST file is empty or not a JSON object: " + artifact);
            }
            return AstNode.of(root);
        } catch (JsonParseException e) {
            throw new AstLoadException("Malformed AST JSON in " + artifact + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new AstLoadException("Failed to read AST file " + artifact + ": " + e.getMessage(), e);
        }
    }

    /** The {@code SourceUnit} under the artifact's {@code ast} key. */
    public AstNode loadSourceUnit(Path artifact) {
        return load(artifact).get("ast");
    }
}
