package com.github.salilvnair.proofgen.engine.guard.core;

public enum GuardViolation {
    PATH_SAFETY_VIOLATION,
    OUTPUT_OVERLAP_CONFLICT,
    TEMPLATE_COMPILE_ERROR,
    GRAPH_PARSE_ERROR,
    QUERY_EXECUTION_ERROR,
    NON_DETERMINISM_DETECTED,
    BOUNDS_EXCEEDED,
    CUSTOM
}
