package com.hpb.compiler.ast.decl;

/**
 * import 可见性
 */
public enum ImportVisibility {
    /** import public "x.proto"; 依赖方可传递看到 */
    PUBLIC,
    PRIVATE
}
