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

package io.deepblu.di.module;

import com.google.common.collect.ImmutableList;
import io.deepblu.di.*;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Base class for declarative modules.
 * <pre>
 * public final class UserModule extends AbstractModule {
 * 	&#64;Override
 * 	protected void configure() {
 * 		imports(DummyModule.class);
 * 		bind(new Key&lt;Repo&lt;User&gt;&gt;() {}, UserSQLRepo.class);
 * 		add(UserService.class);
 * 	}
 * }
 * </pre>
 * {@link #configure()} runs once, the first time the declaration is read.
 * After that the declaration is frozen and the declaration methods fail with {@link IllegalStateException}.
 * If {@code configure()} throws, nothing of the declaration is kept: the failure is rethrown
 * and every later read fails with an {@link IllegalStateException} caused by it.
 */
public abstract class AbstractModule implements Module {
	private enum State {NEW, CONFIGURING, FROZEN, FAILED}

	private State state = State.NEW;
	@Nullable
	private Throwable failure;

	private List<Class<? extends Module>> imports = new ArrayList<>();
	private List<Binding<?>> providers = new ArrayList<>();
	private List<Class<? extends Module>> exports = new ArrayList<>();

	@Nullable
	private volatile Registry registry;

	protected void configure() {
	}

	@SafeVarargs
	protected final void imports(@NotNull Class<? extends Module>... modules) {
		checkConfiguring();
		imports.addAll(Arrays.asList(modules));
	}

	@SafeVarargs
	protected final void export(@NotNull Class<? extends Module>... modules) {
		checkConfiguring();
		exports.addAll(Arrays.asList(modules));
	}

	protected final void provide(@NotNull Binding<?>... bindings) {
		checkConfiguring();
		for (Binding<?> binding : bindings) {
			providers.add(checkNotNull(binding));
		}
	}

	protected final <T> void bind(@NotNull Key<T> key, @NotNull Provider<? extends T> provider) {
		provide(Binding.of(key, provider));
	}

	protected final <T> void bind(@NotNull Class<T> type, @NotNull Provider<? extends T> provider) {
		provide(Binding.of(type, provider));
	}

	protected final <T> void bind(@NotNull Key<T> key, @NotNull Class<? extends T> implementation) {
		provide(Binding.of(key, implementation));
	}

	protected final <T> void bind(@NotNull Class<T> type, @NotNull Class<? extends T> implementation) {
		provide(Binding.of(type, implementation));
	}

	protected final <T> void bind(@NotNull Key<T> key, @NotNull Injectable<? extends T> injectable) {
		provide(Binding.of(key, injectable));
	}

	protected final void add(@NotNull Class<?>... types) {
		for (Class<?> type : types) {
			provide(Binding.self(type));
		}
	}

	private void checkConfiguring() {
		checkState(state == State.CONFIGURING, "Declaration of %s is only possible from configure()", getClass().getName());
	}

	private synchronized void ensureConfigured() {
		if (state == State.FROZEN) {
			return;
		}
		if (state == State.FAILED) {
			throw new IllegalStateException("Declaration of " + getClass().getName() + " has failed", failure);
		}
		checkState(state == State.NEW, "Module %s is read from its own configure()", getClass().getName());
		state = State.CONFIGURING;
		try {
			configure();
		} catch (RuntimeException | Error e) {
			imports = ImmutableList.of();
			providers = ImmutableList.of();
			exports = ImmutableList.of();
			failure = e;
			state = State.FAILED;
			throw e;
		}
		imports = ImmutableList.copyOf(imports);
		providers = ImmutableList.copyOf(providers);
		exports = ImmutableList.copyOf(exports);
		state = State.FROZEN;
	}

	@NotNull
	@Override
	public final List<Class<? extends Module>> getImports() {
		ensureConfigured();
		return imports;
	}

	@NotNull
	@Override
	public final List<Binding<?>> getProviders() {
		ensureConfigured();
		return providers;
	}

	@NotNull
	@Override
	public final List<Class<? extends Module>> getExports() {
		ensureConfigured();
		return exports;
	}

	@NotNull
	@Override
	public Registry getRegistry() {
		Registry registry = this.registry;
		return registry != null ? registry : Registry.global();
	}

	final void attachTo(@NotNull Registry registry) {
		this.registry = registry;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{imports=" + getImports().size() + ", providers=" + getProviders().size() + '}';
	}
}
