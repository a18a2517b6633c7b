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

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static io.deepblu.di.util.ReflectionUtils.getShortName;
import static java.util.stream.Collectors.joining;

/**
 * A declared association of a {@link Key} with the way its instances are produced.
 * <p>
 * Bindings are inert until they enter a {@link Registry}: only then is the target compiled
 * into a {@link Provider}, so a class target is constructed with its dependencies injected
 * from the registry it was bound into. The constructor of a class target is looked up when
 * the provider is first invoked, a class that cannot be constructed fails on resolution.
 */
public final class Binding<T> {
	@NotNull
	private final Key<T> key;
	@NotNull
	private final Function<Registry, Provider<? extends T>> compiler;
	@NotNull
	private final String target;

	private Binding(@NotNull Key<T> key, @NotNull Function<Registry, Provider<? extends T>> compiler, @NotNull String target) {
		this.key = key;
		this.compiler = compiler;
		this.target = target;
	}

	public static <T> Binding<T> of(@NotNull Key<T> key, @NotNull Provider<? extends T> provider) {
		checkNotNull(provider);
		return new Binding<>(checkNotNull(key), $ -> provider, "provider " + provider);
	}

	public static <T> Binding<T> of(@NotNull Class<T> type, @NotNull Provider<? extends T> provider) {
		return of(Key.of(type), provider);
	}

	public static <T> Binding<T> of(@NotNull Key<T> key, @NotNull Class<? extends T> implementation) {
		checkImplementation(key, implementation);
		return new Binding<>(key, registry -> () -> Injectable.ofConstructor(implementation).call(registry),
				"class " + getShortName(implementation));
	}

	public static <T> Binding<T> of(@NotNull Class<T> type, @NotNull Class<? extends T> implementation) {
		return of(Key.of(type), implementation);
	}

	public static <T> Binding<T> of(@NotNull Key<T> key, @NotNull Injectable<? extends T> injectable) {
		checkNotNull(injectable);
		return new Binding<>(checkNotNull(key), injectable::bindTo, "injectable " + injectable);
	}

	public static <T> Binding<T> of(@NotNull Class<T> type, @NotNull Injectable<? extends T> injectable) {
		return of(Key.of(type), injectable);
	}

	/**
	 * Binds a class to itself, its instances are constructed through constructor injection.
	 */
	public static <T> Binding<T> self(@NotNull Class<T> type) {
		return of(Key.of(type), type);
	}

	/**
	 * Binds a list key to all the given implementations.
	 * Every invocation of the compiled provider constructs one instance of each implementation,
	 * in the given order, and returns them as an unmodifiable list.
	 */
	@SafeVarargs
	public static <T> Binding<List<T>> many(@NotNull Key<List<T>> key, @NotNull Class<? extends T>... implementations) {
		List<Class<? extends T>> classes = ImmutableList.copyOf(implementations);
		return new Binding<>(checkNotNull(key), registry -> () -> {
			List<T> instances = new ArrayList<>(classes.size());
			for (Class<? extends T> implementation : classes) {
				instances.add(Injectable.ofConstructor(implementation).call(registry));
			}
			return Collections.unmodifiableList(instances);
		}, classes.stream().map(c -> getShortName(c)).collect(joining(", ", "many [", "]")));
	}

	/**
	 * Binds a list key to the results of the given providers, invoked in order.
	 */
	public static <T> Binding<List<T>> manyOf(@NotNull Key<List<T>> key, @NotNull List<? extends Provider<? extends T>> providers) {
		List<Provider<? extends T>> copy = ImmutableList.copyOf(providers);
		return new Binding<>(checkNotNull(key), $ -> () -> createAll(copy), "many of " + copy.size() + " providers");
	}

	private static <T> List<T> createAll(List<? extends Provider<? extends T>> providers) {
		List<T> instances = new ArrayList<>(providers.size());
		for (Provider<? extends T> provider : providers) {
			instances.add(provider.create());
		}
		return Collections.unmodifiableList(instances);
	}

	private static void checkImplementation(Key<?> key, Class<?> implementation) {
		checkNotNull(key);
		checkNotNull(implementation);
		checkArgument(key.getRawType().isAssignableFrom(implementation),
				"%s is not an implementation of %s", implementation.getName(), key.getDisplayString());
	}

	@NotNull
	public Key<T> getKey() {
		return key;
	}

	/**
	 * Compiles this binding against the registry it is bound into.
	 */
	@NotNull
	public Provider<? extends T> compile(@NotNull Registry registry) {
		return compiler.apply(registry);
	}

	public String getDisplayString() {
		return key.getDisplayString() + " -> " + target;
	}

	@Override
	public String toString() {
		return "Binding{" + getDisplayString() + '}';
	}
}
