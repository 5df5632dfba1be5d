package com.security.logle.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 类型表达式（不可变）
 *
 * 封闭的递归和类型：Int / Bool / String / Pointer / Tuple / Set。
 * 构造函数私有，只能通过 makeXxx 工厂方法创建；新增种类必须同时扩展 {@link Visitor}，
 * 所有消费方在编译期即被强制处理全部种类。
 *
 * name 仅用于描述（如 "timestamp"），参与 equals 但不参与类型检查。
 */
@Getter
public abstract class Type {

    private final String name;
    private final AstKind kind;

    private Type(String name, AstKind kind) {
        if (name == null) {
            throw new IllegalArgumentException("type name cannot be null");
        }
        this.name = name;
        this.kind = kind;
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * 类型访问者，每个种类一个方法
     */
    public interface Visitor<R> {
        R visitInt(IntType type);
        R visitBool(BoolType type);
        R visitString(StringType type);
        R visitPointer(PointerType type);
        R visitTuple(TupleType type);
        R visitSet(SetType type);
    }

    // ========== 工厂方法 ==========

    public static IntType makeInt(String name, boolean signed) {
        return new IntType(name, signed);
    }

    public static BoolType makeBool(String name) {
        return new BoolType(name);
    }

    public static StringType makeString(String name) {
        return new StringType(name);
    }

    public static PointerType makePointer(String name, String targetTag) {
        return new PointerType(name, targetTag);
    }

    public static TupleType makeTuple(String name, List<Type> children) {
        return new TupleType(name, children);
    }

    public static SetType makeSet(String name, Type elementType) {
        return new SetType(name, elementType);
    }

    // ========== 具体种类 ==========

    @Getter
    public static final class IntType extends Type {
        private final boolean signed;

        private IntType(String name, boolean signed) {
            super(name, AstKind.INT);
            this.signed = signed;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInt(this);
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && signed == ((IntType) o).signed;
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + Boolean.hashCode(signed);
        }

        @Override
        public String toString() {
            return signed ? "int" : "uint";
        }
    }

    public static final class BoolType extends Type {
        private BoolType(String name) {
            super(name, AstKind.BOOL);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBool(this);
        }

        @Override
        public String toString() {
            return "bool";
        }
    }

    public static final class StringType extends Type {
        private StringType(String name) {
            super(name, AstKind.STRING);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }

        @Override
        public String toString() {
            return "string";
        }
    }

    @Getter
    public static final class PointerType extends Type {
        /** 被引用的节点标签 */
        private final String targetTag;

        private PointerType(String name, String targetTag) {
            super(name, AstKind.POINTER);
            if (targetTag == null || targetTag.isEmpty()) {
                throw new IllegalArgumentException("pointer target tag cannot be empty");
            }
            this.targetTag = targetTag;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPointer(this);
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && targetTag.equals(((PointerType) o).targetTag);
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + targetTag.hashCode();
        }

        @Override
        public String toString() {
            return "*" + targetTag;
        }
    }

    @Getter
    public static final class TupleType extends Type {
        private final List<Type> children;

        private TupleType(String name, List<Type> children) {
            super(name, AstKind.TUPLE);
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
            return super.equals(o) && children.equals(((TupleType) o).children);
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + children.hashCode();
        }

        @Override
        public String toString() {
            return "tuple" + children;
        }
    }

    @Getter
    public static final class SetType extends Type {
        private final Type elementType;

        private SetType(String name, Type elementType) {
            super(name, AstKind.SET);
            if (elementType == null) {
                throw new IllegalArgumentException("set element type cannot be null");
            }
            this.elementType = elementType;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSet(this);
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && elementType.equals(((SetType) o).elementType);
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + elementType.hashCode();
        }

        @Override
        public String toString() {
            return "set<" + elementType + ">";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Type other = (Type) o;
        return kind == other.kind && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
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
