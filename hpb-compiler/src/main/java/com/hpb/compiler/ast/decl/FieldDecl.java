package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;

import java.util.Objects;

/**
 * 带规则的字段
 */
public class FieldDecl extends AstNode implements MessageField {
    private final FieldRule rule;
    private final Field field;

    public FieldDecl(FieldRule rule, Field field) {
        this.rule = Objects.requireNonNull(rule, "rule");
        this.field = Objects.requireNonNull(field, "field");
    }

    public FieldRule getRule() {
        return rule;
    }

    public Field getField() {
        return field;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFieldDecl(this, context);
    }
}
