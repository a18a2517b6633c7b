/*
 * Copyright (C) 2023 The Deepblu Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.deepblu.result;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Outcome of a computation that either succeeded with a value ({@code Ok})
 * or failed with an error ({@code Error}).
 * <p>
 * Unlike a thrown exception, a {@code Result} is an ordinary value: it can be
 * returned, stored and compared. On the {@code Ok} variant {@link #getError()}
 * is always {@code null}; on the {@code Error} variant {@link #getValue()} is
 * always {@code null}.
 * <p>
 * Two results are equal when their values are equal and their errors are equal,
 * where two errors are considered equal if they are of the same class and carry
 * the same message, even if they are distinct exception instances.
 */
public final class Result<T> {
	private static final Result<?> OK_NULL = new Result<>(null, null, true);

	@Nullable
	private final T value;
	@Nullable
	private final Exception error;
	private final boolean ok;

	private Result(@Nullable T value, @Nullable Exception error, boolean ok) {
		this.value = value;
		this.error = error;
		this.ok = ok;
	}

	/**
	 * Creates a result from its raw components.
	 *
	 * @throws IllegalArgumentException if {@code ok} is {@code true} and {@code error} is not {@code null}
	 */
	@NotNull
	public static <T> Result<T> of(@Nullable T value, @Nullable Exception error, boolean ok) {
		checkArgument(!ok || error == null, "Result cannot be both ok and error");
		return new Result<>(ok ? value : null, error, ok);
	}

	@NotNull
	@SuppressWarnings("unchecked")
	public static <T> Result<T> ok() {
		return (Result<T>) OK_NULL;
	}

	@NotNull
	public static <T> Result<T> ok(@Nullable T value) {
		return value == null ? ok() : new Result<>(value, null, true);
	}

	@NotNull
	public static <T> Result<T> error() {
		return new Result<>(null, null, false);
	}

	@NotNull
	public static <T> Result<T> error(@Nullable Exception error) {
		return new Result<>(null, error, false);
	}

	/**
	 * Creates an error result whose error is a plain {@link Exception} carrying the given message.
	 * A {@code null} message yields an error result without an error object, same as {@link #error()}.
	 */
	@NotNull
	public static <T> Result<T> error(@Nullable String message) {
		return new Result<>(null, message != null ? new Exception(message) : null, false);
	}

	public boolean isOk() {
		return ok;
	}

	public boolean isError() {
		return !ok;
	}

	@Nullable
	public T getValue() {
		return value;
	}

	@Nullable
	public Exception getError() {
		return error;
	}

	public T getOr(T defaultValue) {
		return ok ? value : defaultValue;
	}

	/**
	 * Returns the value of an {@code Ok} result, or throws the error of an {@code Error} result.
	 * An {@code Error} without an error object throws {@link IllegalStateException}.
	 */
	public T getOrThrow() throws Exception {
		if (ok) {
			return value;
		}
		if (error != null) {
			throw error;
		}
		throw new IllegalStateException("Result is an error without an exception");
	}

	public <U> Result<U> map(@NotNull Function<? super T, ? extends U> fn) {
		if (ok) {
			return ok(fn.apply(value));
		}
		return mold();
	}

	public <U> Result<U> flatMap(@NotNull Function<? super T, Result<U>> fn) {
		if (ok) {
			return fn.apply(value);
		}
		return mold();
	}

	public Result<T> mapError(@NotNull Function<? super Exception, ? extends Exception> fn) {
		if (ok) {
			return this;
		}
		return error(fn.apply(error));
	}

	public <U> U match(@NotNull Function<? super T, ? extends U> onOk, @NotNull Function<? super Exception, ? extends U> onError) {
		return ok ? onOk.apply(value) : onError.apply(error);
	}

	public Result<T> ifOk(@NotNull Consumer<? super T> consumer) {
		if (ok) {
			consumer.accept(value);
		}
		return this;
	}

	public Result<T> ifError(@NotNull Consumer<? super Exception> consumer) {
		if (!ok) {
			consumer.accept(error);
		}
		return this;
	}

	@SuppressWarnings("unchecked")
	private <U> Result<U> mold() {
		checkState(!ok, "Trying to mold an ok Result!");
		return (Result<U>) this;
	}

	static boolean errorsEqual(@Nullable Exception first, @Nullable Exception second) {
		if (first == second) return true;
		if (first == null || second == null) return false;
		if (first.equals(second)) return true;
		return first.getClass() == second.getClass() && Objects.equals(first.getMessage(), second.getMessage());
	}

	/**
	 * Results are equal when their values are equal and their errors are of the same class with the same message.
	 * The ok flag is compared too, so {@code ok()} never equals {@code error()} although both carry nothing.
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Result<?> other = (Result<?>) o;
		return ok == other.ok && Objects.equals(value, other.value) && errorsEqual(error, other.error);
	}

	@Override
	public int hashCode() {
		int hash = value != null ? value.hashCode() : 0;
		hash = 31 * hash + (error != null ? 31 * error.getClass().hashCode() + Objects.hashCode(error.getMessage()) : 0);
		return 31 * hash + (ok ? 1 : 0);
	}

	@Override
	public String toString() {
		return ok ? "Ok(" + value + ")" : "Error(" + (error != null ? error.getMessage() : null) + ")";
	}
}
