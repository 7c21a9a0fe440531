package com.jsanalyzer.analyze.rewrite;

/**
 * Which operand of a binary operator an expression is placed in.
 */
public enum OperandSide {
    LEFT,
    RIGHT
}
