package com.stagewise.engine.compiler.expression;

public enum MembershipOperator {
    /** Left value is an element / substring of the right value. */
    IN("in"),
    NOT_IN("not_in"),
    /** Right value is an element / substring / key of the left value. */
    CONTAINS("contains");

    private final String keyword;

    MembershipOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
