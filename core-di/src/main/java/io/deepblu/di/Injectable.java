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
import io.deepblu.di.error.DIException;
import io.deepblu.di.error.ProvisionException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static io.deepblu.di.util.ReflectionUtils.*;
import static java.util.Collections.emptyMap;
import static java.util.stream.Collectors.joining;

/**
 * A callable whose named parameters are filled from a {@link Registry}.
 * <p>
 * An injectable declares its parameters as an ordered list of {@link Dependency dependencies}.
 * When it is called, every parameter the caller did not supply explicitly and whose key is bound
 * in the registry is resolved through {@link Registry#get(Key)}. Parameters that are neither supplied
 * nor bound are left out; reading a required one from {@link Arguments} then fails with
 * {@link io.deepblu.di.error.MissingArgumentException}. Resolution is not transitive by itself:
 * a resolved value is only injected in turn if its own provider is injectable.
 * <p>
 * Injectables are declared explicitly with a {@link #builder(String) builder}
 * <pre>
 * Injectable&lt;UserService&gt; userService = Injectable.builder("userService")
 *         .with("repo", new Key&lt;Repo&lt;User&gt;&gt;() {})
 *         .build(args -&gt; new UserService(args.get("repo")));
 * </pre>
 * or derived from an {@link io.deepblu.di.annotation.Inject inject constructor} with {@link #ofConstructor(Class)}.
 */
public final class Injectable<R> {
	private static final Logger logger = LoggerFactory.getLogger(Injectable.class);

	private static final Map<Class<?>, Injectable<?>> constructorInjectables = new ConcurrentHashMap<>();

	@FunctionalInterface
	public interface Body<R> {
		R call(Arguments args);
	}

	private final String displayName;
	private final List<Dependency> dependencies;
	private final Map<String, Dependency> dependenciesByName;
	private final Body<R> body;

	private Injectable(String displayName, List<Dependency> dependencies, Body<R> body) {
		this.displayName = displayName;
		this.dependencies = ImmutableList.copyOf(dependencies);
		this.body = body;
		Map<String, Dependency> byName = new LinkedHashMap<>();
		for (Dependency dependency : dependencies) {
			checkArgument(byName.put(dependency.getName(), dependency) == null,
					"Duplicate parameter '%s' in %s", dependency.getName(), displayName);
		}
		this.dependenciesByName = Collections.unmodifiableMap(byName);
	}

	public static Builder builder(@NotNull String displayName) {
		return new Builder(checkNotNull(displayName));
	}

	/**
	 * An injectable without parameters that delegates to the given provider.
	 */
	public static <R> Injectable<R> of(@NotNull String displayName, @NotNull Provider<? extends R> provider) {
		checkNotNull(provider);
		return new Injectable<>(displayName, Collections.emptyList(), args -> provider.create());
	}

	/**
	 * Returns the injectable that constructs instances of the given class.
	 * <p>
	 * The constructor annotated with {@link io.deepblu.di.annotation.Inject} is used with its parameters
	 * injected. Classes without one are constructed through their no-argument constructor.
	 * The class is inspected once, later calls return the cached injectable.
	 *
	 * @throws DIException if the class cannot be constructed in either way
	 */
	@SuppressWarnings("unchecked")
	public static <R> Injectable<R> ofConstructor(@NotNull Class<R> cls) {
		return (Injectable<R>) constructorInjectables.computeIfAbsent(checkNotNull(cls), Injectable::createConstructorInjectable);
	}

	private static <R> Injectable<R> createConstructorInjectable(Class<R> cls) {
		Constructor<R> constructor = findInjectConstructor(cls);
		if (constructor == null) {
			constructor = findDefaultConstructor(cls);
			if (constructor == null) {
				throw new DIException(cls.getName() + " has neither an inject constructor nor a no-argument constructor");
			}
		}
		constructor.setAccessible(true);
		Dependency[] dependencies = toDependencies(constructor);
		Constructor<R> finalConstructor = constructor;
		logger.trace("Inspected constructor of {} with dependencies {}", cls.getName(), Arrays.toString(dependencies));
		return new Injectable<>(getShortName(cls), Arrays.asList(dependencies), args -> {
			Object[] values = new Object[dependencies.length];
			for (int i = 0; i < dependencies.length; i++) {
				values[i] = args.get(dependencies[i].getName());
			}
			return newInstance(finalConstructor, values);
		});
	}

	private static <R> R newInstance(Constructor<R> constructor, Object[] args) {
		try {
			return constructor.newInstance(args);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			if (cause instanceof Error) {
				throw (Error) cause;
			}
			throw new ProvisionException("Constructor of " + constructor.getDeclaringClass().getName() + " failed", cause);
		} catch (InstantiationException | IllegalAccessException e) {
			throw new ProvisionException("Cannot instantiate " + constructor.getDeclaringClass().getName(), e);
		}
	}

	@NotNull
	public String getDisplayName() {
		return displayName;
	}

	@NotNull
	public List<Dependency> getDependencies() {
		return dependencies;
	}

	public R call(@NotNull Registry registry) {
		return call(registry, emptyMap());
	}

	/**
	 * Resolves the missing arguments against the registry and invokes the body.
	 * Explicit arguments always take precedence over bindings.
	 *
	 * @throws IllegalArgumentException if an explicit argument names no declared parameter
	 */
	public R call(@NotNull Registry registry, @NotNull Map<String, ?> explicitArguments) {
		return body.call(resolve(registry, explicitArguments));
	}

	@NotNull
	public Arguments resolve(@NotNull Registry registry, @NotNull Map<String, ?> explicitArguments) {
		for (String name : explicitArguments.keySet()) {
			checkArgument(dependenciesByName.containsKey(name), "Unexpected argument '%s' for %s", name, displayName);
		}
		Map<String, Object> values = new LinkedHashMap<>();
		for (Dependency dependency : dependencies) {
			String name = dependency.getName();
			if (explicitArguments.containsKey(name)) {
				values.put(name, explicitArguments.get(name));
			} else if (registry.hasBinding(dependency.getKey())) {
				logger.trace("Injecting {} into {}", dependency.getDisplayString(), displayName);
				values.put(name, registry.get(dependency.getKey()));
			}
		}
		return new Arguments(displayName, dependenciesByName, values);
	}

	/**
	 * Binds this injectable to a registry, producing a callable {@link Provider}.
	 */
	@NotNull
	public Injected<R> bindTo(@NotNull Registry registry) {
		return new Injected<>(this, checkNotNull(registry), emptyMap());
	}

	@Override
	public String toString() {
		return displayName + dependencies.stream().map(Dependency::getDisplayString).collect(joining(", ", "(", ")"));
	}

	public static final class Builder {
		private final String displayName;
		private final List<Dependency> dependencies = new ArrayList<>();

		private Builder(String displayName) {
			this.displayName = displayName;
		}

		public Builder with(@NotNull String name, @NotNull Key<?> key) {
			dependencies.add(new Dependency(name, key, true));
			return this;
		}

		public Builder with(@NotNull String name, @NotNull Class<?> type) {
			return with(name, Key.of(type));
		}

		public Builder withOptional(@NotNull String name, @NotNull Key<?> key) {
			dependencies.add(new Dependency(name, key, false));
			return this;
		}

		public Builder withOptional(@NotNull String name, @NotNull Class<?> type) {
			return withOptional(name, Key.of(type));
		}

		public <R> Injectable<R> build(@NotNull Body<R> body) {
			return new Injectable<>(displayName, dependencies, checkNotNull(body));
		}
	}
}
