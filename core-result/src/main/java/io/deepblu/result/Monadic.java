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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * Adapters which turn functions that may throw into functions returning {@link Result}.
 * <p>
 * Wrapped functions never rethrow: a normal return becomes {@code Result.ok(value)} and any
 * {@link Exception} becomes {@code Result.error(exception)}. {@link Error}s are not caught.
 * <p>
 * The asynchronous variants accept functions returning a {@link CompletionStage}. Both a
 * synchronous throw and an exceptional completion of the stage are reified, with
 * {@link CompletionException} and {@link ExecutionException} wrappers removed. Cancellation
 * is not a failure of the operation: a {@link CancellationException} cancels the returned
 * stage instead of becoming an error result.
 */
public final class Monadic {
	private static final Logger logger = LoggerFactory.getLogger(Monadic.class);

	private Monadic() {
		throw new AssertionError();
	}

	@NotNull
	public static <T> Supplier<Result<T>> monadic(@NotNull ThrowingSupplier<? extends T> fn) {
		return () -> call(fn);
	}

	@NotNull
	public static <T, R> Function<T, Result<R>> monadic(@NotNull ThrowingFunction<? super T, ? extends R> fn) {
		return t -> call(() -> fn.apply(t));
	}

	@NotNull
	public static <T, U, R> BiFunction<T, U, Result<R>> monadic(@NotNull ThrowingBiFunction<? super T, ? super U, ? extends R> fn) {
		return (t, u) -> call(() -> fn.apply(t, u));
	}

	@NotNull
	public static <T> Supplier<CompletionStage<Result<T>>> monadicAsync(@NotNull AsyncSupplier<T> fn) {
		return () -> callAsync(fn);
	}

	@NotNull
	public static <T, R> Function<T, CompletionStage<Result<R>>> monadicAsync(@NotNull AsyncFunction<? super T, R> fn) {
		return t -> callAsync(() -> fn.apply(t));
	}

	@NotNull
	public static <T, U, R> BiFunction<T, U, CompletionStage<Result<R>>> monadicAsync(@NotNull AsyncBiFunction<? super T, ? super U, R> fn) {
		return (t, u) -> callAsync(() -> fn.apply(t, u));
	}

	/**
	 * Invokes the supplier right away and reifies its outcome.
	 */
	@NotNull
	public static <T> Result<T> call(@NotNull ThrowingSupplier<? extends T> fn) {
		try {
			return Result.ok(fn.get());
		} catch (Exception e) {
			logger.trace("Reified exception as error result", e);
			return Result.error(e);
		}
	}

	/**
	 * Invokes the supplier right away and returns a stage which completes with the
	 * reified outcome once the supplied stage settles.
	 */
	@NotNull
	public static <T> CompletionStage<Result<T>> callAsync(@NotNull AsyncSupplier<T> fn) {
		CompletionStage<T> stage;
		try {
			stage = fn.get();
		} catch (CancellationException e) {
			CompletableFuture<Result<T>> cancelled = new CompletableFuture<>();
			cancelled.completeExceptionally(e);
			return cancelled;
		} catch (Exception e) {
			logger.trace("Reified exception as error result", e);
			return completedFuture(Result.error(e));
		}
		if (stage == null) {
			return completedFuture(Result.error(new NullPointerException("Asynchronous function returned null instead of a stage")));
		}

		CompletableFuture<Result<T>> result = new CompletableFuture<>();
		stage.whenComplete((value, e) -> {
			if (e == null) {
				result.complete(Result.ok(value));
				return;
			}
			Throwable cause = unwrap(e);
			if (cause instanceof Exception && !(cause instanceof CancellationException)) {
				logger.trace("Reified exceptional completion as error result", cause);
				result.complete(Result.error((Exception) cause));
			} else {
				result.completeExceptionally(cause);
			}
		});
		return result;
	}

	private static Throwable unwrap(Throwable e) {
		Throwable cause = e;
		while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
			cause = cause.getCause();
		}
		return cause;
	}
}
