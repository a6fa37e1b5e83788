package com.flowchart.fsmc.emit;

/** Depth of the generated smoke suite. */
public enum TestStyle {
    /** Creation, start/stop, defaults, determinism. */
    SMOKE,
    /** Smoke checks plus one test per event and context structure checks. */
    COMPREHENSIVE
}
