package com.ddm.iris;

import com.ddm.iris.defined.SkinLookup;

import java.lang.reflect.Type;

/**
 * 查找键与目标类型的组合在结构上不可能成立（例如以 {@code Integer} 请求颜色槽位）。
 * <p>
 * 这是调用方的编程错误，而不是数据错误，因此以异常形式抛出，
 * 与"无法转换"（{@link com.ddm.iris.utils.CoercionFailure}）区分开。
 *
 * @author liyifei
 * @since 1.0
 */
public class LookupContractException extends IllegalArgumentException {

    private final transient SkinLookup<?> lookup;
    private final transient Type slotType;

    public LookupContractException(SkinLookup<?> lookup, Type slotType) {
        super("Lookup " + lookup + " cannot be satisfied by a slot of type " + slotType.getTypeName());
        this.lookup = lookup;
        this.slotType = slotType;
    }

    public SkinLookup<?> getLookup() {
        return lookup;
    }

    public Type getSlotType() {
        return slotType;
    }
}
