package com.jsanalyzer.analyze.rule;

public enum ActionCategory {
    /** A fix for the problem a diagnostic reports. */
    QUICK_FIX,
    /** A change that is not tied to a problem. */
    REFACTOR
}
