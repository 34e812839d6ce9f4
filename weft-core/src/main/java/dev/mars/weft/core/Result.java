/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.weft.core;

import dev.mars.weft.core.exceptions.WeftException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Algebraic data type for the outcome of a public engine operation.
 *
 * <p>Public control-surface methods never throw; they return either a {@link Success}
 * carrying the value or a {@link Failure} carrying the {@link WeftException} that
 * describes what went wrong.</p>
 *
 * <h3>Permitted subtypes</h3>
 * <ul>
 *   <li>{@link Success} - the operation completed; carries the value (may be null for void operations)</li>
 *   <li>{@link Failure} - the operation was rejected or failed; carries the error</li>
 * </ul>
 *
 * @param <T> the type of value produced on success
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static Result<Void> success() {
        return new Success<>(null);
    }

    static <T> Result<T> failure(WeftException error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the success value.
     *
     * @throws IllegalStateException if this is a failure
     */
    T getValue();

    /**
     * Returns the failure cause.
     *
     * @throws IllegalStateException if this is a success
     */
    WeftException getError();

    default Optional<T> toOptional() {
        return isSuccess() ? Optional.ofNullable(getValue()) : Optional.empty();
    }

    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (isSuccess()) {
            return new Success<>(mapper.apply(getValue()));
        }
        return new Failure<>(getError());
    }

    /**
     * The operation completed.
     *
     * @param value the resulting value
     * @param <T>   value type
     */
    record Success<T>(T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public WeftException getError() {
            throw new IllegalStateException("Success has no error");
        }
    }

    /**
     * The operation failed or was rejected.
     *
     * @param error the failure cause
     * @param <T>   value type (phantom)
     */
    record Failure<T>(WeftException error) implements Result<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Failure has no value: " + error.getMessage());
        }

        @Override
        public WeftException getError() {
            return error;
        }
    }
}
