package com.codelogickeep.testgen.model;

/**
 * Counter kinds a JaCoCo report attaches to report, package, class and method nodes.
 */
public enum CounterType {
    INSTRUCTION,
    BRANCH,
    LINE,
    COMPLEXITY,
    METHOD,
    CLASS;

    /** Value of the counter's {@code type} attribute */
    public String xmlName() {
        return name();
    }
}
