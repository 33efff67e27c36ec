package com.bsa.analyzer.cfg;

public enum LoopRole {
    INIT, HEADER, BODY, INCREMENT, EXIT
}
