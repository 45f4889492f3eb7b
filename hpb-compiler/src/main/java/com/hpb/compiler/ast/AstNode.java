package com.hpb.compiler.ast;

/**
 * AST 节点基类
 *
 * <p>节点本身不携带源码位置，需要报告诊断的叶子由 {@link Located} 包装。</p>
 */
public abstract class AstNode {

    public abstract <R, C> R accept(AstVisitor<R, C> visitor, C context);
}
