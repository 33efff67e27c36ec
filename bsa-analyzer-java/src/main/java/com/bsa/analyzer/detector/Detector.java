package com.bsa.analyzer.detector;

import com.bsa.analyzer.static_analysis.ContractSummary;

import java.util.List;

public interface Detector {

    /** Registry key, also the {@code detector} field of every finding. */
    String name();

    List<Finding> detect(ContractSummary contract);
}
