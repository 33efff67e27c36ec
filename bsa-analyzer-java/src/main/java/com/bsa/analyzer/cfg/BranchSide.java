package com.bsa.analyzer.cfg;

public enum BranchSide {
    TRUE, FALSE
}
