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
 * 服务声明
 */
public class ServiceDecl extends AstNode implements Decl {
    private final Located<Identifier> name;
    private final List<ServiceField> fields;

    public ServiceDecl(Located<Identifier> name, List<ServiceField> fields) {
        this.name = Objects.requireNonNull(name, "name");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public Located<Identifier> getName() {
        return name;
    }

    public List<ServiceField> getFields() {
        return fields;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitServiceDecl(this, context);
    }
}
