package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Identifier;
import com.hpb.compiler.ast.Located;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * extend 声明：向目标消息的扩展范围追加字段
 */
public class ExtendDecl extends AstNode implements Decl, MessageField {
    private final Located<Identifier> target;
    private final List<FieldDecl> fields;

    public ExtendDecl(Located<Identifier> target, List<FieldDecl> fields) {
        this.target = Objects.requireNonNull(target, "target");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public Located<Identifier> getTarget() {
        return target;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExtendDecl(this, context);
    }
}
