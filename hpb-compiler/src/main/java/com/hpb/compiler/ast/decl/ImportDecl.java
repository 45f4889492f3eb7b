package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstNode;
import com.hpb.compiler.ast.AstVisitor;
import com.hpb.compiler.ast.Located;
import com.hpb.compiler.ast.literal.StringLiteral;

import java.util.Objects;

/**
 * 导入声明：{@code import [public] "path";}
 */
public class ImportDecl extends AstNode implements Decl {
    private final ImportVisibility visibility;
    private final Located<StringLiteral> path;

    public ImportDecl(ImportVisibility visibility, Located<StringLiteral> path) {
        this.visibility = Objects.requireNonNull(visibility, "visibility");
        this.path = Objects.requireNonNull(path, "path");
    }

    public ImportVisibility getVisibility() {
        return visibility;
    }

    public boolean isPublic() {
        return visibility == ImportVisibility.PUBLIC;
    }

    public Located<StringLiteral> getPath() {
        return path;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitImportDecl(this, context);
    }
}
