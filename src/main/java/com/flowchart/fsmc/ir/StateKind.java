package com.flowchart.fsmc.ir;

/** Kind of a generated state. Diagrams only produce normal and final states. */
public enum StateKind {
    NORMAL,
    FINAL,
    PARALLEL,
    COMPOUND
}
