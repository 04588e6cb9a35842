package com.ddm.iris.utils;

import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * 类型转换结果：成功（值可以是显式的 null）或失败。
 *
 * @author liyifei
 * @param <T> 目标类型
 * @since 1.0
 */
public sealed interface CoercionResult<T> permits CoercionResult.Success, CoercionResult.Failure {

    static <T> CoercionResult<T> success(@Nullable T value) {
        return new Success<>(value);
    }

    static <T> CoercionResult<T> failure(CoercionFailure failure) {
        return new Failure<>(Objects.requireNonNull(failure, "failure"));
    }

    boolean isSuccess();

    record Success<T>(@Nullable T value) implements CoercionResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure<T>(CoercionFailure failure) implements CoercionResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
