package com.hpb.compiler.ast;

/**
 * 复合名称没有任何组成部分
 */
public class MalformedNameException extends RuntimeException {

    public MalformedNameException(String message) {
        super(message);
    }
}
