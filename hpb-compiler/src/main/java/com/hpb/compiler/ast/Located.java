package com.hpb.compiler.ast;

import java.util.Objects;
import java.util.function.Function;

/**
 * 带源码位置的值
 *
 * <p>位置指向产生该值的词法单元的起点。包装是透明的，除携带位置外没有其他行为。</p>
 *
 * @param <T> 被包装的值类型
 */
public final class Located<T> {
    private final T value;
    private final SourcePos pos;

    public Located(T value, SourcePos pos) {
        this.value = Objects.requireNonNull(value, "value");
        this.pos = Objects.requireNonNull(pos, "pos");
    }

    /** 手工构造树时使用，位置为 {@link SourcePos#UNKNOWN} */
    public static <T> Located<T> unknown(T value) {
        return new Located<>(value, SourcePos.UNKNOWN);
    }

    public T getValue() {
        return value;
    }

    public SourcePos getPos() {
        return pos;
    }

    /**
     * 变换被包装的值，保留原位置
     */
    public <U> Located<U> map(Function<? super T, ? extends U> mapper) {
        return new Located<>(mapper.apply(value), pos);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Located)) return false;
        Located<?> other = (Located<?>) o;
        return value.equals(other.value) && pos.equals(other.pos);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, pos);
    }

    @Override
    public String toString() {
        return value + "@" + pos;
    }
}
