package com.ddm.iris.utils;

import com.ddm.iris.LookupContractException;
import com.ddm.iris.defined.Colour4;
import com.ddm.iris.defined.SkinLookup;
import com.ddm.iris.defined.SkinLookups;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 类型转换引擎：把配置源中存储的字符串转换为查找键要求的类型。
 *
 * <p><strong>转换规则：</strong>
 * <ul>
 *   <li>原始值为 null：目标为 String/Object 时成功返回 null，其余类型失败（NotConvertible）</li>
 *   <li>String：原样返回，不做 trim</li>
 *   <li>数值类型：与区域设置无关的解析（小数点固定为 {@code .}）</li>
 *   <li>Boolean：{@code 1}/{@code true} 为真，{@code 0}/{@code false} 为假（忽略大小写），其余失败</li>
 *   <li>枚举：按常量名精确匹配（区分大小写）</li>
 *   <li>{@link Colour4}：{@code r,g,b[,a]}</li>
 *   <li>其他类型：值形如 JSON 对象/数组时交给 Jackson 反序列化</li>
 * </ul>
 * 数据层面的失败一律以 {@link CoercionResult.Failure} 返回，不会向外抛出异常。
 *
 * @author liyifei
 * @since 1.0
 */
public final class Converters {

    private static final Logger log = LoggerFactory.getLogger(Converters.class);

    /**
     * 线程安全的单例 ObjectMapper
     */
    private static final ObjectMapper JSON = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * 纯十进制写法（可带指数），不接受 Java 字面量后缀与十六进制浮点
     */
    private static final Pattern DECIMAL = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private Converters() {
    }

    /**
     * 将原始字符串转换为目标类型。
     *
     * @param raw    原始值，null 表示配置项显式为空
     * @param target 目标类型
     * @param <T>    目标类型
     * @return 转换结果，不会为 null
     */
    @SuppressWarnings("unchecked")
    public static <T> CoercionResult<T> coerce(@Nullable String raw, Type target) {
        Class<?> type = rawClass(target);
        if (raw == null) {
            if (isNullable(type)) return CoercionResult.success(null);
            return CoercionResult.failure(CoercionFailure.notConvertible(null, target,
                    "null value for non-nullable type"));
        }
        try {
            return CoercionResult.success((T) convert(raw, target, type));
        } catch (Exception e) {
            log.trace("[coerce] convert failed: raw={} -> {}, error={}", raw, target.getTypeName(), e.getMessage());
            return CoercionResult.failure(CoercionFailure.notConvertible(raw, target, String.valueOf(e.getMessage())));
        }
    }

    /**
     * 校验查找键的目标类型与其结构化槽位是否兼容；以字符串存储的查找键总是兼容。
     *
     * @throws LookupContractException 如果组合在结构上不可能成立
     */
    public static void requireCompatible(SkinLookup<?> lookup) {
        Type slot = SkinLookups.slotType(lookup);
        if (slot != null) requireSlotType(lookup, slot);
    }

    /**
     * 校验查找键的目标类型能否容纳结构化槽位的类型。
     *
     * @param lookup   查找键
     * @param slotType 存储槽位的实际类型
     * @throws LookupContractException 如果组合在结构上不可能成立
     */
    public static void requireSlotType(SkinLookup<?> lookup, Type slotType) {
        if (!canHold(lookup.valueType(), slotType)) {
            throw new LookupContractException(lookup, slotType);
        }
    }

    /**
     * 判断 {@code requested} 类型的变量能否持有 {@code slot} 类型的值。
     * 参数化类型逐个比较类型参数（通配符按上界处理）。
     */
    static boolean canHold(Type requested, Type slot) {
        if (!rawClass(requested).isAssignableFrom(rawClass(slot))) return false;
        if (requested instanceof ParameterizedType rp && slot instanceof ParameterizedType sp) {
            Type[] wanted = rp.getActualTypeArguments();
            Type[] actual = sp.getActualTypeArguments();
            if (wanted.length != actual.length) return false;
            for (int i = 0; i < wanted.length; i++) {
                if (!rawClass(wanted[i]).isAssignableFrom(rawClass(actual[i]))) return false;
            }
        }
        return true;
    }

    /**
     * 取类型的原始 Class：参数化类型取 raw type，通配符取上界，无法确定时为 Object。
     */
    public static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> c) return c;
        if (type instanceof ParameterizedType p) return rawClass(p.getRawType());
        if (type instanceof WildcardType w) {
            Type[] upper = w.getUpperBounds();
            return upper.length == 0 ? Object.class : rawClass(upper[0]);
        }
        if (type instanceof GenericArrayType) return Object[].class;
        return Object.class;
    }

    /* ===================== helpers ===================== */

    private static boolean isNullable(Class<?> type) {
        return type == String.class || type == CharSequence.class || type == Object.class;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convert(String raw, Type target, Class<?> type) throws Exception {
        if (isNullable(type)) return raw;

        final String s = raw.trim();
        if (s.isEmpty()) throw new IllegalArgumentException("blank value");

        // --- 基础与扩展数值类型 ---
        if (type == Integer.class || type == int.class) return Integer.valueOf(s);
        if (type == Long.class || type == long.class) return Long.valueOf(s);
        if (type == Short.class || type == short.class) return Short.valueOf(s);
        if (type == Byte.class || type == byte.class) return Byte.valueOf(s);
        if (type == Float.class || type == float.class) return Float.valueOf(checkDecimal(s));
        if (type == Double.class || type == double.class) return Double.valueOf(checkDecimal(s));
        if (type == BigDecimal.class) return new BigDecimal(s);
        if (type == BigInteger.class) return new BigInteger(s);

        // --- Boolean：skin.ini 习惯用 1/0 表示开关 ---
        if (type == Boolean.class || type == boolean.class) return parseBoolean(s);

        // --- 枚举：精确匹配常量名 ---
        if (type.isEnum()) return Enum.valueOf((Class) type, s);

        if (type == Colour4.class) {
            Colour4 colour = Colour4.parse(s);
            if (colour == null) throw new IllegalArgumentException("not a colour: " + s);
            return colour;
        }

        // --- JSON 对象/数组 ---
        if ((s.startsWith("{") && s.endsWith("}")) || (s.startsWith("[") && s.endsWith("]"))) {
            return JSON.readValue(s, JSON.getTypeFactory().constructType(target));
        }

        throw new IllegalArgumentException("unsupported target type " + target.getTypeName());
    }

    /**
     * 只接受纯十进制写法，拒绝 {@code 1.5f}、{@code 0x1p3} 等 Java 字面量后缀。
     */
    private static String checkDecimal(String s) {
        if (!DECIMAL.matcher(s).matches()) {
            throw new NumberFormatException("not a decimal number: " + s);
        }
        return s;
    }

    private static Boolean parseBoolean(String s) {
        switch (s.toLowerCase(Locale.ROOT)) {
            case "1":
            case "true":
                return Boolean.TRUE;
            case "0":
            case "false":
                return Boolean.FALSE;
            default:
                throw new IllegalArgumentException("not a boolean token: " + s);
        }
    }
}
