package com.codelogickeep.testgen.tools;

/**
 * Fixed shapes of a generated test body. Case index 0 maps to the first constant,
 * index 1 to the second, and every later index reuses the last constant.
 */
public enum ScaffoldVariant {

    /** Construct, call, then assert the instance still equals itself. */
    INSTANCE_EQUALITY {
        @Override
        void appendStatements(StringBuilder sb, String simpleClassName, String invocation) {
            line(sb, simpleClassName + " instance = new " + simpleClassName + "();");
            line(sb, "assertNotNull(instance);");
            blank(sb);
            if (invocation != null) {
                line(sb, invocation);
                blank(sb);
            }
            line(sb, "assertEquals(instance, instance);");
        }
    },

    /** Construct, then assert the call does not throw. */
    DOES_NOT_THROW {
        @Override
        void appendStatements(StringBuilder sb, String simpleClassName, String invocation) {
            line(sb, simpleClassName + " instance = new " + simpleClassName + "();");
            blank(sb);
            line(sb, "assertDoesNotThrow(() -> {");
            line(sb, "    " + (invocation != null ? invocation : "new " + simpleClassName + "();"));
            line(sb, "});");
            blank(sb);
            line(sb, "assertNotNull(instance);");
        }
    },

    /** Construct, call, then assert the instance keeps its declared type. */
    TYPE_CHECK {
        @Override
        void appendStatements(StringBuilder sb, String simpleClassName, String invocation) {
            line(sb, simpleClassName + " instance = new " + simpleClassName + "();");
            if (invocation != null) {
                line(sb, invocation);
            }
            blank(sb);
            line(sb, "Object result = instance;");
            line(sb, "assertNotNull(result);");
            line(sb, "assertTrue(result instanceof " + simpleClassName + ");");
        }
    };

    private static final String METHOD_INDENT = "    ";
    private static final String STATEMENT_INDENT = "        ";

    public static ScaffoldVariant forIndex(int caseIndex) {
        ScaffoldVariant[] variants = values();
        return variants[Math.max(0, Math.min(caseIndex, variants.length - 1))];
    }

    /**
     * Renders a complete {@code @Test} method.
     *
     * @param testMethodName  name of the generated test method
     * @param simpleClassName class under test, instantiated with its no-arg constructor
     * @param methodName      method to call on the instance; null or empty when only construction is exercised
     */
    public String render(String testMethodName, String simpleClassName, String methodName) {
        String invocation = methodName == null || methodName.isEmpty() ? null : "instance." + methodName + "();";

        StringBuilder sb = new StringBuilder();
        sb.append(METHOD_INDENT).append("@Test\n");
        sb.append(METHOD_INDENT).append("public void ").append(testMethodName).append("() {\n");
        appendStatements(sb, simpleClassName, invocation);
        sb.append(METHOD_INDENT).append("}");
        return sb.toString();
    }

    abstract void appendStatements(StringBuilder sb, String simpleClassName, String invocation);

    private static void line(StringBuilder sb, String statement) {
        sb.append(STATEMENT_INDENT).append(statement).append('\n');
    }

    private static void blank(StringBuilder sb) {
        sb.append('\n');
    }
}
