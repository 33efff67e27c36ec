package com.bsa.analyzer.detector;

import com.bsa.analyzer.static_analysis.ContractSummary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detectors by name, in registration order.
 */
public class DetectorRegistry {

    public static class UnknownDetectorException extends RuntimeException {
        public UnknownDetectorException(String msg) { super(msg); }
    }

    private final Map<String, Detector> detectors = new LinkedHashMap<>();

    /** A registry holding every built-in detector. */
    public static DetectorRegistry withDefaults(DetectionMode mode) {
        DetectorRegistry registry = new DetectorRegistry();
        registry.register(new ReentrancyDetector(mode));
        return registry;
    }

    /** Registers {@code detector}, replacing any detector with the same name. */
    public void register(Detector detector) {
        detectors.put(detector.name(), detector);
    }

    public Optional<Detector> get(String name) {
        return Optional.ofNullable(detectors.get(name));
    }

    public List<String> names() {
        return new ArrayList<>(detectors.keySet());
    }

    /** @throws UnknownDetectorException if no detector is registered under {@code name} */
    public List<Finding> run(String name, ContractSummary contract) {
        Detector detector = get(name).orElseThrow(
                () -> new UnknownDetectorException("Unknown detector: " + name + " (known: " + names() + ")"));
        return detector.detect(contract);
    }

    public Map<String, List<Finding>> runAll(ContractSummary contract) {
        return runSelected(names(), contract);
    }

    /** Runs the named detectors in the given order; an empty selection runs all of them. */
    public Map<String, List<Finding>> runSelected(List<String> selection, ContractSummary contract) {
        List<String> chosen = selection.isEmpty() ? names() : selection;
        Map<String, List<Finding>> results = new LinkedHashMap<>();
        for (String name : chosen) {
            results.put(name, run(name, contract));
        }
        return results;
    }
}
