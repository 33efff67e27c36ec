package com.bsa.analyzer.detector;

public record Finding(String detector, String contract, String function, String description, String severity) {}
