package com.hpb.compiler.ast;

import java.util.Objects;

/**
 * 标识符
 *
 * <p>相等性与排序均按文本比较，下游可直接用作 Map/Set 的键。</p>
 */
public final class Identifier implements Comparable<Identifier> {
    private final String text;

    public Identifier(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public int compareTo(Identifier other) {
        return text.compareTo(other.text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier)) return false;
        return text.equals(((Identifier) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
