package com.security.logle.util;

import com.security.logle.model.Type;
import com.security.logle.model.Value;

import java.util.List;
import java.util.function.Function;

/**
 * 类型检查工具类
 *
 * 递归检查值是否符合类型：
 * 1. 基础种类必须完全一致，Int 还要求有无符号一致
 * 2. Tuple 元数相同，且逐个位置符合
 * 3. Set 的每个元素都符合元素类型
 * 4. Pointer 目标标签相同，且被引用值符合该标签在 schema 中登记的类型
 *
 * 只返回 true/false，从不抛异常；调用方负责把 false 转换为 TYPE_MISMATCH。
 */
public final class TypeChecker {

    private static final Function<String, Type> NO_POINTERS = tag -> null;

    private TypeChecker() {
    }

    /**
     * 不解析指针的类型检查：任何指针值都不通过
     */
    public static boolean typeCheck(Type type, Value value) {
        return typeCheck(type, value, NO_POINTERS);
    }

    /**
     * @param resolver 标签 -> 类型，用于解析指针；返回 null 表示标签未登记
     */
    public static boolean typeCheck(Type type, Value value, Function<String, Type> resolver) {
        if (type == null || value == null) {
            return false;
        }
        if (type.getKind() != value.getKind()) {
            return false;
        }
        return type.accept(new Checker(value, resolver));
    }

    private static final class Checker implements Type.Visitor<Boolean> {
        private final Value value;
        private final Function<String, Type> resolver;

        Checker(Value value, Function<String, Type> resolver) {
            this.value = value;
            this.resolver = resolver;
        }

        @Override
        public Boolean visitInt(Type.IntType type) {
            return type.isSigned() == ((Value.IntValue) value).isSigned();
        }

        @Override
        public Boolean visitBool(Type.BoolType type) {
            return true;
        }

        @Override
        public Boolean visitString(Type.StringType type) {
            return true;
        }

        @Override
        public Boolean visitPointer(Type.PointerType type) {
            Value.PointerValue pointer = (Value.PointerValue) value;
            if (!type.getTargetTag().equals(pointer.getTargetTag())) {
                return false;
            }
            Type target = resolver.apply(type.getTargetTag());
            return target != null && typeCheck(target, pointer.getReferent(), resolver);
        }

        @Override
        public Boolean visitTuple(Type.TupleType type) {
            List<Type> childTypes = type.getChildren();
            List<Value> children = ((Value.TupleValue) value).getChildren();
            if (childTypes.size() != children.size()) {
                return false;
            }
            for (int i = 0; i < childTypes.size(); i++) {
                if (!typeCheck(childTypes.get(i), children.get(i), resolver)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public Boolean visitSet(Type.SetType type) {
            for (Value element : ((Value.SetValue) value).getElements()) {
                if (!typeCheck(type.getElementType(), element, resolver)) {
                    return false;
                }
            }
            return true;
        }
    }
}
