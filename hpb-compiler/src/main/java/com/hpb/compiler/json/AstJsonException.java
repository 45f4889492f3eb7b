package com.hpb.compiler.json;

/**
 * JSON 语法树解码失败
 */
public class AstJsonException extends RuntimeException {
    private final String path;

    public AstJsonException(String message, String path) {
        super(message);
        this.path = path;
    }

    public AstJsonException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** 出错成员的 JSON 路径，如 {@code $.declarations[2].name} */
    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        if (path == null) {
            return super.getMessage();
        }
        return super.getMessage() + " at " + path;
    }
}
