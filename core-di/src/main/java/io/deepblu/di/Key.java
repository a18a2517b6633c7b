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

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Identifies an interface in a {@link Registry}.
 * <p>
 * A key is a Java type plus an optional name. Plain classes are keyed with {@link #of(Class)},
 * parameterized types are captured by subclassing:
 * <pre>
 * Key&lt;Repo&lt;User&gt;&gt; key = new Key&lt;Repo&lt;User&gt;&gt;() {};
 * </pre>
 * Two keys are equal when their types and names are equal, regardless of how they were created.
 */
public abstract class Key<T> {
	@NotNull
	private final Type type;
	@Nullable
	private final String name;

	public Key(@Nullable String name) {
		this.name = name;
		this.type = getSuperclassTypeParameter(getClass());
	}

	public Key() {
		this(null);
	}

	private Key(@NotNull Type type, @Nullable String name) {
		this.type = type;
		this.name = name;
	}

	// so that we have one reusable non-abstract impl
	private static <T> Key<T> create(Type type, @Nullable String name) {
		return new Key<T>(type, name) {};
	}

	@NotNull
	public static <T> Key<T> of(@NotNull Class<T> type) {
		return create(checkNotNull(type), null);
	}

	@NotNull
	public static <T> Key<T> of(@NotNull Class<T> type, @Nullable String name) {
		return create(checkNotNull(type), name);
	}

	@NotNull
	public static <T> Key<T> ofType(@NotNull Type type) {
		return create(checkNotNull(type), null);
	}

	@NotNull
	public static <T> Key<T> ofType(@NotNull Type type, @Nullable String name) {
		return create(checkNotNull(type), name);
	}

	@NotNull
	private static Type getSuperclassTypeParameter(@NotNull Class<?> subclass) {
		Type superclass = subclass.getGenericSuperclass();
		if (superclass instanceof ParameterizedType) {
			return ((ParameterizedType) superclass).getActualTypeArguments()[0];
		}
		throw new IllegalArgumentException("Unsupported type: " + superclass);
	}

	@NotNull
	public Type getType() {
		return type;
	}

	@SuppressWarnings("unchecked")
	@NotNull
	public Class<T> getRawType() {
		if (type instanceof Class) {
			return (Class<T>) type;
		} else if (type instanceof ParameterizedType) {
			return (Class<T>) ((ParameterizedType) type).getRawType();
		} else {
			throw new IllegalArgumentException(type.getTypeName());
		}
	}

	public Type[] getTypeParams() {
		if (type instanceof ParameterizedType) {
			return ((ParameterizedType) type).getActualTypeArguments();
		}
		return new Type[0];
	}

	@Nullable
	public String getName() {
		return name;
	}

	/**
	 * Returns the key with package prefixes stripped, e.g. {@code "primary" List<UseCase<?, ?>>}.
	 */
	public String getDisplayString() {
		return (name != null ? "\"" + name + "\" " : "") + type.getTypeName().replaceAll("(?:\\w+\\.)*(\\w+)", "$1");
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Key)) {
			return false;
		}

		Key<?> key = (Key<?>) o;

		return type.equals(key.type) && Objects.equals(name, key.name);
	}

	@Override
	public int hashCode() {
		return 31 * type.hashCode() + (name != null ? name.hashCode() : 0);
	}

	@Override
	public String toString() {
		return (name != null ? "@Named(" + name + ") " : "") + type.getTypeName();
	}
}
