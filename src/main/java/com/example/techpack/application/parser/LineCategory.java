package com.example.techpack.application.parser;

/**
 * Mutually exclusive technical-table category of a line, in precedence order.
 */
public enum LineCategory {
    GRADING,
    CONSTRUCTION,
    BASE_MEASUREMENT
}
