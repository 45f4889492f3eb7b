package com.hpb.compiler.ast.decl;

import com.hpb.compiler.ast.AstVisitor;

/**
 * 消息体成员：字段、选项、oneof、扩展范围以及嵌套的 enum/message/extend
 */
public interface MessageField {

    <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
