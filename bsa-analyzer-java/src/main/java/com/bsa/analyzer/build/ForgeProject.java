package com.bsa.analyzer.build;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Locates Solidity sources and their AST artifacts in a Foundry-style project layout.
 */
public class ForgeProject {

    private final String srcDir;
    private final String outDir;

    public ForgeProject(String srcDir, String outDir) {
        this.srcDir = srcDir;
        this.outDir = outDir;
    }

    /**
     * Every {@code .sol} file under the source directory, keyed by file name without extension.
     * Empty when the directory does not exist.
     */
    public Map<String, Path> findSourceFiles(Path projectRoot) {
        Path src = projectRoot.resolve(srcDir);
        Map<String, Path> files = new TreeMap<>();
        if (!Files.isDirectory(src)) return files;
        try (Stream<Path> walk = Files.walk(src)) {
            for (Path p : walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".sol"))
                    .collect(Collectors.toList())) {
                String name = p.getFileName().toString();
                files.putIfAbsent(name.substring(0, name.length() - ".sol".length()), p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Error listing sources under " + src, e);
        }
        return files;
    }

    /** For each name, the sorted {@code *.json} files in {@code <out>/<Name>.sol/}. */
    public List<Path> findAstFiles(Path projectRoot, Collection<String> names) {
        List<Path> out = new ArrayList<>();
        for (String name : names) {
            Path dir = projectRoot.resolve(outDir).resolve(name + ".sol");
            if (!Files.isDirectory(dir)) continue;
            try (Stream<Path> list = Files.list(dir)) {
                out.addAll(list.filter(p -> p.getFileName().toString().endsWith(".json"))
                        .sorted()
                        .collect(Collectors.toList()));
            } catch (IOException e) {
                throw new UncheckedIOException("Error listing artifacts under " + dir, e);
            }
        }
        return out;
    }
}
