package com.bsa.analyzer.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the export model to {@code analysis.json}. The output carries no timestamps, so
 * identical input gives byte-identical files.
 */
public class AnalysisSerializer {

    public static final String FILE_NAME = "analysis.json";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    public String toJson(AnalysisModel.AnalysisRoot root) {
        return gson.toJson(root);
    }

    /**
     * @param outputDir directory to write into (created if absent)
     * @return the written file
     */
    public Path write(AnalysisModel.AnalysisRoot root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }
        Path target = outputDir.resolve(FILE_NAME);
        try (Writer w = new FileWriter(target.toFile(), StandardCharsets.UTF_8)) {
            gson.toJson(root, w);
            w.write('\n');
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + FILE_NAME + ": " + e.getMessage(), e);
        }
        System.err.println("[bsa] " + FILE_NAME + " written: " + target);
        return target;
    }
}
