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
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An {@link Injectable} bound to a {@link Registry}: calling it resolves the missing
 * arguments in that registry. Explicit arguments given with {@link #with(String, Object)}
 * or {@link #call(Map)} always take precedence.
 */
public final class Injected<R> implements Provider<R> {
	private final Injectable<R> injectable;
	private final Registry registry;
	private final Map<String, Object> explicitArguments;

	Injected(Injectable<R> injectable, Registry registry, Map<String, ?> explicitArguments) {
		this.injectable = injectable;
		this.registry = registry;
		this.explicitArguments = Collections.unmodifiableMap(new LinkedHashMap<>(explicitArguments));
	}

	public R call() {
		return injectable.call(registry, explicitArguments);
	}

	public R call(@NotNull Map<String, ?> arguments) {
		Map<String, Object> merged = new LinkedHashMap<>(explicitArguments);
		merged.putAll(arguments);
		return injectable.call(registry, merged);
	}

	/**
	 * Returns a copy of this callable with one more explicit argument.
	 */
	public Injected<R> with(@NotNull String name, @Nullable Object value) {
		Map<String, Object> merged = new LinkedHashMap<>(explicitArguments);
		merged.put(name, value);
		return new Injected<>(injectable, registry, merged);
	}

	@Override
	public R create() {
		return call();
	}

	public Injectable<R> getInjectable() {
		return injectable;
	}

	public Registry getRegistry() {
		return registry;
	}

	@Override
	public String toString() {
		return injectable.toString();
	}
}
