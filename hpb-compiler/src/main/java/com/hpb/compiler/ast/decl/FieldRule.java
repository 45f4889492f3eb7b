package com.hpb.compiler.ast.decl;

/**
 * 字段规则
 */
public enum FieldRule {
    REQUIRED("required"),
    OPTIONAL("optional"),
    REPEATED("repeated");

    private final String keyword;

    FieldRule(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
