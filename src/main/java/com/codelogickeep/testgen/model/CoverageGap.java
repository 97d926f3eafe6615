package com.codelogickeep.testgen.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A method with incomplete line coverage, as found in a JaCoCo report.
 */
@Value
@Builder
public class CoverageGap {
    /** Dotted fully qualified class name (e.g., "com.acme.Widget") */
    String classFullName;

    /** Method name followed by its raw descriptor (e.g., "render()V"); null for class-level gaps */
    String methodSignature;

    /** Dotted package name, empty for the default package */
    @Builder.Default
    String packageName = "";

    /** Line coverage percentage (0-100) */
    double lineCoveragePct;

    /** Branch coverage percentage (0-100), 0 when the method has no branches */
    double branchCoveragePct;

    /** 1-based line numbers without any covered instruction, ascending */
    @Singular
    List<Integer> uncoveredLines;

    /** Method name without the descriptor, empty when there is no method */
    public String getBareMethodName() {
        if (methodSignature == null) return "";
        int paren = methodSignature.indexOf('(');
        return paren >= 0 ? methodSignature.substring(0, paren) : methodSignature;
    }

    /** Last dotted segment of the class name */
    public String getSimpleClassName() {
        if (classFullName == null) return "";
        int lastDot = classFullName.lastIndexOf('.');
        return lastDot >= 0 ? classFullName.substring(lastDot + 1) : classFullName;
    }
}
