package com.phillippitts.ctcdecode.service.lm;

/**
 * How n-gram tables are brought into memory.
 */
public enum LoadMethod {
    /** Memory-map the file and page tables in on demand. */
    LAZY,
    /** Copy the tables onto the heap at load time. */
    READ
}
