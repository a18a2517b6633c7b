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

import io.deepblu.di.error.MissingArgumentException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Arguments an {@link Injectable} is invoked with: the explicitly supplied ones merged with those
 * resolved from the registry. Parameters that were neither supplied nor resolved are absent.
 */
public final class Arguments {
	private final String callable;
	private final Map<String, Dependency> dependencies;
	private final Map<String, Object> values;

	Arguments(String callable, Map<String, Dependency> dependencies, Map<String, Object> values) {
		this.callable = callable;
		this.dependencies = dependencies;
		this.values = values;
	}

	/**
	 * Returns the argument of the given parameter.
	 * An absent optional parameter reads as {@code null}.
	 *
	 * @throws MissingArgumentException if a required parameter is absent
	 */
	@SuppressWarnings("unchecked")
	public <T> T get(@NotNull String name) {
		Dependency dependency = getDependency(name);
		if (!values.containsKey(name)) {
			if (dependency.isRequired()) {
				throw new MissingArgumentException(callable, dependency);
			}
			return null;
		}
		return (T) values.get(name);
	}

	@Nullable
	public <T> T getOrNull(@NotNull String name) {
		return getOr(name, null);
	}

	@SuppressWarnings("unchecked")
	public <T> T getOr(@NotNull String name, T defaultValue) {
		getDependency(name);
		return values.containsKey(name) ? (T) values.get(name) : defaultValue;
	}

	public boolean has(@NotNull String name) {
		return values.containsKey(name);
	}

	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(values);
	}

	private Dependency getDependency(String name) {
		Dependency dependency = dependencies.get(name);
		checkArgument(dependency != null, "%s declares no parameter '%s'", callable, name);
		return dependency;
	}

	@Override
	public String toString() {
		return callable + values;
	}
}
