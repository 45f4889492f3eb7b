package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstVisitor;

/**
 * 顶层声明：import、option、enum、message、extend、service
 */
public interface Decl {

    <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
