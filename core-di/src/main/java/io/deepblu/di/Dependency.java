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

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named parameter of an {@link Injectable} together with the key used to resolve it.
 */
public final class Dependency {
	@NotNull
	private final String name;
	@NotNull
	private final Key<?> key;
	private final boolean required;

	public Dependency(@NotNull String name, @NotNull Key<?> key, boolean required) {
		this.name = checkNotNull(name);
		this.key = checkNotNull(key);
		this.required = required;
	}

	@NotNull
	public String getName() {
		return name;
	}

	@NotNull
	public Key<?> getKey() {
		return key;
	}

	public boolean isRequired() {
		return required;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}

		Dependency that = (Dependency) o;

		return required == that.required && name.equals(that.name) && key.equals(that.key);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, key, required);
	}

	public String getDisplayString() {
		return (required ? "" : "optional ") + name + ": " + key.getDisplayString();
	}

	@Override
	public String toString() {
		return "{" + (required ? "" : "optional ") + name + ": " + key + "}";
	}
}
