package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstVisitor;

/**
 * 服务体成员：选项或 rpc 方法
 */
public interface ServiceField {

    <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
