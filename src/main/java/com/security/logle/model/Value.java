package com.security.logle.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * 值表达式（不可变）
 *
 * 与 {@link Type} 的种类一一对应：三种基础字面量、Pointer、Tuple、Set。
 * Set 在构造时即规范化：元素按 {@link ValueComparator} 排序并去重，
 * 因此 equals/hashCode 与元素的插入顺序无关，可直接用作去重索引的键。
 *
 * toString() 输出扁平化文本，导出器直接使用。
 */
@Getter
public abstract class Value {

    private final AstKind kind;

    private Value(AstKind kind) {
        this.kind = kind;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * 值访问者，每个种类一个方法
     */
    public interface Visitor<R> {
        R visitInt(IntValue value);
        R visitBool(BoolValue value);
        R visitString(StringValue value);
        R visitPointer(PointerValue value);
        R visitTuple(TupleValue value);
        R visitSet(SetValue value);
    }

    // ========== 工厂方法 ==========

    /**
     * 有符号整数
     */
    public static IntValue makeInt(long value) {
        return new IntValue(value, true);
    }

    /**
     * 无符号整数，不接受负数
     */
    public static IntValue makeUnsignedInt(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("unsigned int cannot be negative: " + value);
        }
        return new IntValue(value, false);
    }

    public static BoolValue makeBool(boolean value) {
        return new BoolValue(value);
    }

    public static StringValue makeString(String value) {
        return new StringValue(value);
    }

    public static PointerValue makePointer(String targetTag, Value referent) {
        return new PointerValue(targetTag, referent);
    }

    public static TupleValue makeTuple(List<Value> children) {
        return new TupleValue(children);
    }

    public static TupleValue makeTuple(Value... children) {
        return new TupleValue(Arrays.asList(children));
    }

    public static SetValue makeSet(Collection<Value> elements) {
        return new SetValue(elements);
    }

    public static SetValue makeSet(Value... elements) {
        return new SetValue(Arrays.asList(elements));
    }

    // ========== 具体种类 ==========

    @Getter
    public static final class IntValue extends Value {
        private final long value;
        private final boolean signed;

        private IntValue(long value, boolean signed) {
            super(AstKind.INT);
            this.value = value;
            this.signed = signed;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInt(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof IntValue)) {
                return false;
            }
            IntValue other = (IntValue) o;
            return value == other.value && signed == other.signed;
        }

        @Override
        public int hashCode() {
            return Objects.hash(AstKind.INT, value, signed);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    public static final class BoolValue extends Value {
        private final boolean value;

        private BoolValue(boolean value) {
            super(AstKind.BOOL);
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBool(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BoolValue && value == ((BoolValue) o).value;
        }

        @Override
        public int hashCode() {
            return Objects.hash(AstKind.BOOL, value);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    @Getter
    public static final class StringValue extends Value {
        private final String value;

        private StringValue(String value) {
            super(AstKind.STRING);
            if (value == null) {
                throw new IllegalArgumentException("string value cannot be null");
            }
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof StringValue && value.equals(((StringValue) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(AstKind.STRING, value);
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * 指针值：引用目标标签以及被引用的值本身
     */
    @Getter
    public static final class PointerValue extends Value {
        private final String targetTag;
        private final Value referent;

        private PointerValue(String targetTag, Value referent) {
            super(AstKind.POINTER);
            if (targetTag == null || targetTag.isEmpty()) {
                throw new IllegalArgumentException("pointer target tag cannot be empty");
            }
            if (referent == null) {
                throw new IllegalArgumentException("pointer referent cannot be null");
            }
            this.targetTag = targetTag;
            this.referent = referent;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPointer(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof PointerValue)) {
                return false;
            }
            PointerValue other = (PointerValue) o;
            return targetTag.equals(other.targetTag) && referent.equals(other.referent);
        }

        @Override
        public int hashCode() {
            return Objects.hash(AstKind.POINTER, targetTag, referent);
        }

        @Override
        public String toString() {
            return "*" + targetTag + "(" + referent + ")";
        }
    }

    @Getter
    public static final class TupleValue extends Value {
        private final List<Value> children;

        private TupleValue(List<Value> children) {
            super(AstKind.TUPLE);
            if (children == null || hasNull(children)) {
                throw new IllegalArgumentException("tuple children cannot be null");
            }
            this.children = Collections.unmodifiableList(new ArrayList<>(children));
        }

        public int arity() {
            return children.size();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TupleValue && children.equals(((TupleValue) o).children);
        }

        @Override
        public int hashCode() {
            return Objects.hash(AstKind.TUPLE, children);
        }

        @Override
        public String toString() {
            return join("(", children, ")");
        }
    }

    /**
     * 集合值：elements 为规范顺序且无重复
     */
    @Getter
    public static final class SetValue extends Value {
        private final List<Value> elements;

        private SetValue(Collection<Value> elements) {
            super(AstKind.SET);
            if (elements == null || hasNull(elements)) {
                throw new IllegalArgumentException("set elements cannot be null");
            }
            TreeSet<Value> canonical = new TreeSet<>(ValueComparator.INSTANCE);
            canonical.addAll(elements);
            this.elements = Collections.unmodifiableList(new ArrayList<>(canonical));
        }

        public int size() {
            return elements.size();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSet(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof SetValue && elements.equals(((SetValue) o).elements);
        }

        @Override
        public int hashCode() {
            return Objects.hash(AstKind.SET, elements);
        }

        @Override
        public String toString() {
            return join("{", elements, "}");
        }
    }

    private static String join(String open, List<Value> values, String close) {
        StringBuilder sb = new StringBuilder(open);
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(values.get(i));
        }
        return sb.append(close).toString();
    }

    private static boolean hasNull(Collection<?> items) {
        for (Object item : items) {
            if (item == null) {
                return true;
            }
        }
        return false;
    }
}
