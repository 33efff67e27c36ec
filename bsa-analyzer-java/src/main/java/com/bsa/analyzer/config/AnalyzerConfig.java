package com.bsa.analyzer.config;

import com.bsa.analyzer.detector.DetectionMode;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of the optional {@code bsa.json} project file. Every key is optional.
 */
public class AnalyzerConfig {

    @SerializedName("src_dir")
    private String srcDir;

    @SerializedName("out_dir")
    private String outDir;

    /** Executable used for {@code clean} and {@code build --ast} (default: forge). */
    @SerializedName("forge_command")
    private String forgeCommand;

    @SerializedName("skip_build")
    private Boolean skipBuild;

    /** {@code order} (default) or {@code reachability}. */
    @SerializedName("detection_mode")
    private String detectionMode;

    /** Detector names to run; empty runs every registered detector. */
    @SerializedName("detectors")
    private List<String> detectors;

    public String getSrcDir()       { return srcDir != null ? srcDir : "src"; }
    public String getOutDir()       { return outDir != null ? outDir : "out"; }
    public String getForgeCommand() { return forgeCommand != null ? forgeCommand : "forge"; }
    public boolean isSkipBuild()    { return skipBuild != null && skipBuild; }
    public List<String> getDetectors() { return detectors != null ? detectors : Collections.emptyList(); }

    /** @throws IllegalArgumentException for a mode other than order or reachability */
    public DetectionMode getDetectionMode() {
        return detectionMode != null ? DetectionMode.parse(detectionMode) : DetectionMode.ORDER;
    }

    public void setSkipBuild(boolean skipBuild)         { this.skipBuild = skipBuild; }
    public void setDetectionMode(String detectionMode)  { this.detectionMode = detectionMode; }
}
