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

package io.deepblu.di;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Static shortcuts to the {@link Registry#global() process-wide registry}.
 * <pre>
 * DI.bind(Repo.class, UserSQLRepo.class);
 * UserService service = DI.get(UserService.class);
 * </pre>
 */
public final class DI {
	private DI() {
		throw new AssertionError();
	}

	public static Registry registry() {
		return Registry.global();
	}

	public static <T> Registry bind(@NotNull Key<T> key, @NotNull Provider<? extends T> provider) {
		return registry().bind(key, provider);
	}

	public static <T> Registry bind(@NotNull Class<T> type, @NotNull Provider<? extends T> provider) {
		return registry().bind(type, provider);
	}

	public static <T> Registry bind(@NotNull Key<T> key, @NotNull Class<? extends T> implementation) {
		return registry().bind(key, implementation);
	}

	public static <T> Registry bind(@NotNull Class<T> type, @NotNull Class<? extends T> implementation) {
		return registry().bind(type, implementation);
	}

	public static <T> Registry bind(@NotNull Key<T> key, @NotNull Injectable<? extends T> injectable) {
		return registry().bind(key, injectable);
	}

	public static <T> Registry bind(@NotNull Class<T> type, @NotNull Injectable<? extends T> injectable) {
		return registry().bind(type, injectable);
	}

	public static Registry bindAll(@NotNull Binding<?>... bindings) {
		return registry().bindAll(bindings);
	}

	public static Registry bindAll(@NotNull Iterable<? extends Binding<?>> bindings) {
		return registry().bindAll(bindings);
	}

	public static Registry add(@NotNull Class<?> type) {
		return registry().add(type);
	}

	@SafeVarargs
	public static <T> Registry provideMany(@NotNull Key<List<T>> key, @NotNull Class<? extends T>... implementations) {
		return registry().bind(Binding.many(key, implementations));
	}

	public static <T> T get(@NotNull Key<T> key) {
		return registry().get(key);
	}

	public static <T> T get(@NotNull Class<T> type) {
		return registry().get(type);
	}

	public static <T> T create(@NotNull Key<T> key) {
		return registry().create(key);
	}

	public static <T> T create(@NotNull Class<T> type) {
		return registry().create(type);
	}

	public static <R> Injected<R> inject(@NotNull Injectable<R> injectable) {
		return injectable.bindTo(registry());
	}

	/**
	 * Returns a provider that constructs a new instance of the class on every call,
	 * injecting its constructor parameters from the global registry.
	 */
	public static <R> Injected<R> injectable(@NotNull Class<R> type) {
		return Injectable.ofConstructor(type).bindTo(registry());
	}
}
