package com.security.logle.model;

import java.util.Comparator;
import java.util.List;

/**
 * 值表达式上的全序（规范顺序）
 *
 * 排序规则：
 * 1. 先按种类：INT < BOOL < STRING < POINTER < TUPLE < SET（即 {@link AstKind} 声明顺序）
 * 2. 同种类内：
 *    - Int：无符号在前，再按数值
 *    - Bool：false < true
 *    - String：String.compareTo
 *    - Pointer：先按目标标签，再按被引用值
 *    - Tuple：先按元数，再逐个子节点比较
 *    - Set：先按元素个数，再逐个比较（元素已是规范顺序）
 *
 * 与 Value.equals 一致：compare == 0 当且仅当两个值结构相等。
 */
public final class ValueComparator implements Comparator<Value> {

    public static final ValueComparator INSTANCE = new ValueComparator();

    private ValueComparator() {
    }

    @Override
    public int compare(Value left, Value right) {
        int byKind = left.getKind().compareTo(right.getKind());
        if (byKind != 0) {
            return byKind;
        }
        switch (left.getKind()) {
            case INT: {
                Value.IntValue l = (Value.IntValue) left;
                Value.IntValue r = (Value.IntValue) right;
                int bySign = Boolean.compare(l.isSigned(), r.isSigned());
                return bySign != 0 ? bySign : Long.compare(l.getValue(), r.getValue());
            }
            case BOOL:
                return Boolean.compare(((Value.BoolValue) left).getValue(),
                        ((Value.BoolValue) right).getValue());
            case STRING:
                return ((Value.StringValue) left).getValue()
                        .compareTo(((Value.StringValue) right).getValue());
            case POINTER: {
                Value.PointerValue l = (Value.PointerValue) left;
                Value.PointerValue r = (Value.PointerValue) right;
                int byTag = l.getTargetTag().compareTo(r.getTargetTag());
                return byTag != 0 ? byTag : compare(l.getReferent(), r.getReferent());
            }
            case TUPLE:
                return compareLists(((Value.TupleValue) left).getChildren(),
                        ((Value.TupleValue) right).getChildren());
            case SET:
                return compareLists(((Value.SetValue) left).getElements(),
                        ((Value.SetValue) right).getElements());
            default:
                throw new IllegalStateException("unhandled kind: " + left.getKind());
        }
    }

    private int compareLists(List<Value> left, List<Value> right) {
        int bySize = Integer.compare(left.size(), right.size());
        if (bySize != 0) {
            return bySize;
        }
        for (int i = 0; i < left.size(); i++) {
            int c = compare(left.get(i), right.get(i));
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }
}
