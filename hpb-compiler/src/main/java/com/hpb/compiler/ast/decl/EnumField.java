package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstVisitor;

/**
 * 枚举体成员：枚举值或选项
 */
public interface EnumField {

    <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
