package com.hpb.compiler.ast.type;

import java.util.HashMap;
import java.util.Map;

/**
 * 标量线类型，每个类型对应唯一关键字
 */
public enum ScalarType {
    DOUBLE("double"),
    FLOAT("float"),
    INT32("int32"),
    INT64("int64"),
    UINT32("uint32"),
    UINT64("uint64"),
    SINT32("sint32"),
    SINT64("sint64"),
    FIXED32("fixed32"),
    FIXED64("fixed64"),
    SFIXED32("sfixed32"),
    SFIXED64("sfixed64"),
    BOOL("bool"),
    STRING("string"),
    BYTES("bytes");

    private static final Map<String, ScalarType> BY_KEYWORD = new HashMap<>();

    static {
        for (ScalarType type : values()) {
            BY_KEYWORD.put(type.keyword, type);
        }
    }

    private final String keyword;

    ScalarType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * 按关键字查找标量类型
     *
     * @return 对应类型，非标量关键字返回 null
     */
    public static ScalarType fromKeyword(String keyword) {
        return BY_KEYWORD.get(keyword);
    }

    @Override
    public String toString() {
        return keyword;
    }
}
