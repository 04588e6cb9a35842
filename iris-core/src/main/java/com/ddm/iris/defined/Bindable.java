package com.ddm.iris.defined;

import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 单值可观察容器，承载一次查找解析出的值（可以是显式的 null）。
 * <p>
 * 每次查找都会创建新的实例，不在调用之间缓存；相等性按实例身份判断。
 * 值可以被调用方修改，修改会通知已注册的监听器。
 *
 * @author liyifei
 * @param <T> 值类型
 * @since 1.0
 */
public final class Bindable<T> implements Supplier<T> {

    private final List<Consumer<ValueChanged<T>>> listeners = new CopyOnWriteArrayList<>();

    private volatile T value;

    public Bindable(@Nullable T value) {
        this.value = value;
    }

    public static <T> Bindable<T> of(@Nullable T value) {
        return new Bindable<>(value);
    }

    @Override
    @Nullable
    public T get() {
        return value;
    }

    @Nullable
    public T getValue() {
        return value;
    }

    /**
     * 设置新值；与旧值不同时通知监听器。
     */
    public void setValue(@Nullable T newValue) {
        T old;
        synchronized (this) {
            old = value;
            if (Objects.equals(old, newValue)) return;
            value = newValue;
        }
        ValueChanged<T> event = new ValueChanged<>(old, newValue);
        for (Consumer<ValueChanged<T>> listener : listeners) {
            listener.accept(event);
        }
    }

    public void bindValueChanged(Consumer<ValueChanged<T>> listener) {
        bindValueChanged(listener, false);
    }

    /**
     * 注册值变更监听器。
     *
     * @param listener           监听器
     * @param runOnceImmediately 为 true 时立即以当前值回调一次（旧值与新值相同）
     */
    public void bindValueChanged(Consumer<ValueChanged<T>> listener, boolean runOnceImmediately) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        if (runOnceImmediately) {
            T current = value;
            listener.accept(new ValueChanged<>(current, current));
        }
    }

    public void unbindAll() {
        listeners.clear();
    }

    @Override
    public String toString() {
        return "Bindable[" + value + "]";
    }

    /**
     * 值变更事件。
     */
    public record ValueChanged<T>(@Nullable T oldValue, @Nullable T newValue) {
    }
}
