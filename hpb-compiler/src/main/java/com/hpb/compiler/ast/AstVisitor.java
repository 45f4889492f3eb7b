package com.hpb.compiler.ast;

import com.hpb.compiler.ast.decl.*;

/**
 * AST 访问者接口
 *
 * <p>方法没有默认实现：新增节点类型时，所有实现类（包括打印器）必须补上对应分支，否则编译失败。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 顶层 ============

    R visitPackage(SchemaPackage node, C ctx);

    R visitImportDecl(ImportDecl node, C ctx);

    R visitOptionDecl(OptionDecl node, C ctx);

    // ============ 枚举 ============

    R visitEnumDecl(EnumDecl node, C ctx);

    R visitEnumValue(EnumValue node, C ctx);

    // ============ 消息 ============

    R visitMessageDecl(MessageDecl node, C ctx);

    R visitFieldDecl(FieldDecl node, C ctx);

    R visitField(Field node, C ctx);

    R visitOneOfDecl(OneOfDecl node, C ctx);

    R visitExtensionsDecl(ExtensionsDecl node, C ctx);

    R visitExtendDecl(ExtendDecl node, C ctx);

    // ============ 服务 ============

    R visitServiceDecl(ServiceDecl node, C ctx);

    R visitRpcMethod(RpcMethod node, C ctx);
}
