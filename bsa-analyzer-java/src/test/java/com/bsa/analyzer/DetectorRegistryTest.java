package com.bsa.analyzer;

import com.bsa.analyzer.detector.DetectionMode;
import com.bsa.analyzer.detector.Detector;
import com.bsa.analyzer.detector.DetectorRegistry;
import com.bsa.analyzer.detector.Finding;
import com.bsa.analyzer.static_analysis.ContractSummary;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DetectorRegistryTest {

    private static final ContractSummary EMPTY_CONTRACT = InternalCallInlinerTest.assemble();

    private static Detector fixed(String name) {
        return new Detector() {
            @Override
            public String name() { return name; }

            @Override
            public List<Finding> detect(ContractSummary contract) {
                return List.of(new Finding(name, contract.name(), "f", "always", "Low"));
            }
        };
    }

    @Test
    void defaultsHoldTheReentrancyDetector() {
        DetectorRegistry registry = DetectorRegistry.withDefaults(DetectionMode.ORDER);
        assertEquals(List.of("Reentrancy"), registry.names());
        assertTrue(registry.get("Reentrancy").isPresent());
        assertFalse(registry.get("Missing").isPresent());
    }

    @Test
    void unknownDetectorIsRejected() {
        DetectorRegistry registry = DetectorRegistry.withDefaults(DetectionMode.ORDER);
        Exception ex = assertThrows(DetectorRegistry.UnknownDetectorException.class,
                () -> registry.run("Nope", EMPTY_CONTRACT));
        assertTrue(ex.getMessage().startsWith("Unknown detector: Nope"));
    }

    @Test
    void emptySelectionRunsEverything() {
        DetectorRegistry registry = DetectorRegistry.withDefaults(DetectionMode.ORDER);
        registry.register(fixed("Custom"));
        Map<String, List<Finding>> results = registry.runSelected(List.of(), EMPTY_CONTRACT);
        assertEquals(List.of("Reentrancy", "Custom"), List.copyOf(results.keySet()));
        assertTrue(results.get("Reentrancy").isEmpty());
        assertEquals(1, results.get("Custom").size());
        assertEquals(results, registry.runAll(EMPTY_CONTRACT));
    }

    @Test
    void selectionRunsOnlyTheNamedDetectors() {
        DetectorRegistry registry = DetectorRegistry.withDefaults(DetectionMode.ORDER);
        registry.register(fixed("Custom"));
        Map<String, List<Finding>> results = registry.runSelected(List.of("Custom"), EMPTY_CONTRACT);
        assertEquals(List.of("Custom"), List.copyOf(results.keySet()));
        assertEquals("C", results.get("Custom").get(0).contract());
    }

    @Test
    void registeringTheSameNameReplaces() {
        DetectorRegistry registry = new DetectorRegistry();
        registry.register(fixed("Custom"));
        registry.register(fixed("Custom"));
        assertEquals(List.of("Custom"), registry.names());
        assertEquals(1, registry.run("Custom", EMPTY_CONTRACT).size());
    }
}
