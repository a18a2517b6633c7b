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

import io.deepblu.di.error.CyclicDependencyException;
import io.deepblu.di.error.UnboundKeyException;
import io.deepblu.di.util.ApplicationSettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A mutable table of bindings from {@link Key keys} to {@link Provider providers},
 * together with the singleton instances already created from them.
 * <p>
 * {@link #get(Key)} invokes the bound provider once and returns the memoized instance afterwards,
 * {@link #create(Key)} invokes it on every call. Binding a key again replaces its provider
 * and evicts the instance created by the previous one.
 * <p>
 * A plain registry is not thread-safe, {@link #createThreadsafe()} returns a registry
 * whose every operation is synchronized.
 */
public class Registry {
	private static final Logger logger = LoggerFactory.getLogger(Registry.class);

	public static final boolean THREADSAFE = ApplicationSettings.getBoolean(Registry.class, "threadsafe", false);

	private static final Object NO_KEY = new Object();

	private final Map<Key<?>, Provider<?>> bindings = new HashMap<>();
	private final Map<Key<?>, Object> instances = new HashMap<>();
	private final Set<Class<?>> registeredModules = new LinkedHashSet<>();
	private final ArrayDeque<Key<?>> resolving = new ArrayDeque<>();

	protected static final class SynchronizedRegistry extends Registry {
		@Override
		synchronized public <T> Registry bind(@NotNull Binding<T> binding) {
			return super.bind(binding);
		}

		@Override
		synchronized public <T> T get(@NotNull Key<T> key) {
			return super.get(key);
		}

		@Override
		synchronized public <T> T create(@NotNull Key<T> key) {
			return super.create(key);
		}

		@Override
		synchronized public <T> @NotNull Provider<T> getProvider(@NotNull Key<T> key) {
			return super.getProvider(key);
		}

		@Override
		synchronized public boolean hasBinding(@NotNull Key<?> key) {
			return super.hasBinding(key);
		}

		@Override
		synchronized public Map<Key<?>, Provider<?>> getBindings() {
			return super.getBindings();
		}

		@Override
		synchronized public <T> @Nullable T peekInstance(@NotNull Key<T> key) {
			return super.peekInstance(key);
		}

		@Override
		synchronized public boolean hasInstance(@NotNull Key<?> key) {
			return super.hasInstance(key);
		}

		@Override
		synchronized public Map<Key<?>, Object> getInstances() {
			return super.getInstances();
		}

		@Override
		synchronized public boolean isRegistered(@NotNull Class<?> moduleType) {
			return super.isRegistered(moduleType);
		}

		@Override
		synchronized public boolean markRegistered(@NotNull Class<?> moduleType) {
			return super.markRegistered(moduleType);
		}

		@Override
		synchronized public Set<Class<?>> getRegisteredModules() {
			return super.getRegisteredModules();
		}
	}

	private static final class GlobalHolder {
		static final Registry GLOBAL = THREADSAFE ? new SynchronizedRegistry() : new Registry();
	}

	protected Registry() {
	}

	/**
	 * Returns the process-wide registry. It is synchronized when the {@code Registry.threadsafe}
	 * system property is set.
	 */
	public static Registry global() {
		return GlobalHolder.GLOBAL;
	}

	public static Registry create() {
		return new Registry();
	}

	public static Registry createThreadsafe() {
		return new SynchronizedRegistry();
	}

	// region binding
	public <T> Registry bind(@NotNull Binding<T> binding) {
		Key<T> key = binding.getKey();
		Provider<? extends T> provider = checkNotNull(binding.compile(this), "Binding compiled to null provider: %s", binding);
		Provider<?> previous = bindings.put(key, provider);
		Object evicted = instances.remove(key);
		if (previous != null) {
			logger.debug("Rebound {}{}", binding.getDisplayString(), evicted != null ? ", evicted its instance" : "");
		} else {
			logger.debug("Bound {}", binding.getDisplayString());
		}
		return this;
	}

	public <T> Registry bind(@NotNull Key<T> key, @NotNull Provider<? extends T> provider) {
		return bind(Binding.of(key, provider));
	}

	public <T> Registry bind(@NotNull Class<T> type, @NotNull Provider<? extends T> provider) {
		return bind(Binding.of(type, provider));
	}

	public <T> Registry bind(@NotNull Key<T> key, @NotNull Class<? extends T> implementation) {
		return bind(Binding.of(key, implementation));
	}

	public <T> Registry bind(@NotNull Class<T> type, @NotNull Class<? extends T> implementation) {
		return bind(Binding.of(type, implementation));
	}

	public <T> Registry bind(@NotNull Key<T> key, @NotNull Injectable<? extends T> injectable) {
		return bind(Binding.of(key, injectable));
	}

	public <T> Registry bind(@NotNull Class<T> type, @NotNull Injectable<? extends T> injectable) {
		return bind(Binding.of(type, injectable));
	}

	public Registry bindAll(@NotNull Binding<?>... bindings) {
		return bindAll(Arrays.asList(bindings));
	}

	public Registry bindAll(@NotNull Iterable<? extends Binding<?>> bindings) {
		for (Binding<?> binding : bindings) {
			bind(binding);
		}
		return this;
	}

	/**
	 * Binds a class to itself.
	 */
	public Registry add(@NotNull Class<?> type) {
		return bind(Binding.self(type));
	}
	// endregion

	// region resolution
	public <T> T get(@NotNull Class<T> type) {
		return get(Key.of(type));
	}

	/**
	 * Returns the singleton instance of the key, creating it with the bound provider on first access.
	 * A {@code null} returned by the provider is memoized as well.
	 *
	 * @throws UnboundKeyException       if nothing is bound to the key
	 * @throws CyclicDependencyException if creating the instance requires the instance itself
	 */
	@SuppressWarnings("unchecked")
	public <T> T get(@NotNull Key<T> key) {
		T instance = (T) instances.getOrDefault(key, NO_KEY);
		if (instance != NO_KEY) {
			return instance;
		}
		instance = doCreate(key);
		instances.put(key, instance);
		return instance;
	}

	public <T> T create(@NotNull Class<T> type) {
		return create(Key.of(type));
	}

	/**
	 * Invokes the bound provider, bypassing the singleton instances.
	 */
	public <T> T create(@NotNull Key<T> key) {
		return doCreate(key);
	}

	@NotNull
	public <T> Provider<T> getProvider(@NotNull Class<T> type) {
		return getProvider(Key.of(type));
	}

	/**
	 * Returns the provider bound to the key without invoking it.
	 */
	@SuppressWarnings("unchecked")
	@NotNull
	public <T> Provider<T> getProvider(@NotNull Key<T> key) {
		Provider<T> provider = (Provider<T>) bindings.get(checkNotNull(key));
		if (provider == null) {
			throw new UnboundKeyException(key);
		}
		return provider;
	}

	private <T> T doCreate(Key<T> key) {
		Provider<T> provider = getProvider(key);
		if (resolving.contains(key)) {
			List<Key<?>> cycle = new ArrayList<>();
			boolean inCycle = false;
			for (Iterator<Key<?>> it = resolving.descendingIterator(); it.hasNext(); ) {
				Key<?> k = it.next();
				inCycle |= k.equals(key);
				if (inCycle) {
					cycle.add(k);
				}
			}
			cycle.add(key);
			throw new CyclicDependencyException(cycle);
		}
		resolving.push(key);
		try {
			logger.trace("Creating instance of {}", key.getDisplayString());
			return provider.create();
		} finally {
			resolving.pop();
		}
	}
	// endregion

	// region introspection
	public boolean hasBinding(@NotNull Class<?> type) {
		return hasBinding(Key.of(type));
	}

	public boolean hasBinding(@NotNull Key<?> key) {
		return bindings.containsKey(key);
	}

	public Map<Key<?>, Provider<?>> getBindings() {
		return Collections.unmodifiableMap(bindings);
	}

	@Nullable
	public <T> T peekInstance(@NotNull Class<T> type) {
		return peekInstance(Key.of(type));
	}

	@Nullable
	@SuppressWarnings("unchecked")
	public <T> T peekInstance(@NotNull Key<T> key) {
		return (T) instances.get(key);
	}

	public boolean hasInstance(@NotNull Class<?> type) {
		return hasInstance(Key.of(type));
	}

	public boolean hasInstance(@NotNull Key<?> key) {
		return instances.containsKey(key);
	}

	public Map<Key<?>, Object> getInstances() {
		return Collections.unmodifiableMap(new LinkedHashMap<>(instances));
	}
	// endregion

	// region modules
	public boolean isRegistered(@NotNull Class<?> moduleType) {
		return registeredModules.contains(moduleType);
	}

	/**
	 * Records the module type as registered in this registry.
	 *
	 * @return {@code false} if it was registered already
	 */
	public boolean markRegistered(@NotNull Class<?> moduleType) {
		return registeredModules.add(checkNotNull(moduleType));
	}

	public Set<Class<?>> getRegisteredModules() {
		return Collections.unmodifiableSet(new LinkedHashSet<>(registeredModules));
	}
	// endregion

	public boolean isThreadSafe() {
		return this instanceof SynchronizedRegistry;
	}

	@Override
	public String toString() {
		return (isThreadSafe() ? "SynchronizedRegistry" : "Registry") +
				"{bindings=" + bindings.size() + ", instances=" + instances.size() + ", modules=" + registeredModules.size() + '}';
	}
}
