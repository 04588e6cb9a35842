package com.ddm.iris.utils;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * 类型引用，用于在运行时保留泛型类型信息。
 * <p>
 * 必须通过匿名内部类创建，例如：
 * <pre>{@code
 * Type type = new TypeRef<List<Colour4>>() {}.getType();
 * }</pre>
 * 查找键（{@link com.ddm.iris.defined.SkinLookup}）通过它声明参数化的目标类型，
 * 例如 combo 调色板的 {@code List<Colour4>}。
 *
 * @author liyifei
 * @param <T> 要引用的泛型类型
 * @see com.ddm.iris.defined.SkinLookups
 * @since 1.0
 */
public abstract class TypeRef<T> {

    private final Type type;

    /**
     * @throws IllegalStateException 如果未指定泛型类型
     */
    protected TypeRef() {
        Type generic = getClass().getGenericSuperclass();
        if (generic instanceof ParameterizedType p) {
            this.type = p.getActualTypeArguments()[0];
        } else {
            throw new IllegalStateException(
                    "TypeRef must be constructed with actual generic type, e.g. new TypeRef<List<Colour4>>() {}"
            );
        }
    }

    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return "TypeRef<" + type.getTypeName() + ">";
    }
}
