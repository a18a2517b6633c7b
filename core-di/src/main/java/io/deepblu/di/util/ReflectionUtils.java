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

package io.deepblu.di.util;

import io.deepblu.di.Dependency;
import io.deepblu.di.Key;
import io.deepblu.di.annotation.Inject;
import io.deepblu.di.annotation.Named;
import io.deepblu.di.annotation.Optional;
import io.deepblu.di.error.DIException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;

import static java.util.stream.Collectors.toList;

public final class ReflectionUtils {
	private ReflectionUtils() {
		throw new AssertionError();
	}

	public static String getShortName(Class<?> cls) {
		return cls.getName().substring(cls.getName().lastIndexOf('.') + 1);
	}

	/**
	 * Finds the constructor whose parameters should be injected: the one annotated with {@link Inject},
	 * or, for a class annotated with {@link Inject}, its only public constructor or its no-argument one.
	 *
	 * @return the inject constructor or {@code null} if the class does not declare any
	 * @throws DIException if more than one constructor is annotated with {@link Inject}
	 */
	@SuppressWarnings("unchecked")
	@Nullable
	public static <T> Constructor<T> findInjectConstructor(@NotNull Class<T> cls) {
		checkInstantiable(cls);
		List<Constructor<?>> annotated = Arrays.stream(cls.getDeclaredConstructors())
				.filter(constructor -> constructor.isAnnotationPresent(Inject.class))
				.collect(toList());
		if (annotated.size() > 1) {
			throw new DIException("More than one inject constructor in " + cls.getName());
		}
		if (annotated.size() == 1) {
			return (Constructor<T>) annotated.get(0);
		}
		if (!cls.isAnnotationPresent(Inject.class)) {
			return null;
		}
		Constructor<?>[] publicConstructors = cls.getConstructors();
		if (publicConstructors.length == 1) {
			return (Constructor<T>) publicConstructors[0];
		}
		return findDefaultConstructor(cls);
	}

	@Nullable
	public static <T> Constructor<T> findDefaultConstructor(@NotNull Class<T> cls) {
		try {
			return cls.getDeclaredConstructor();
		} catch (NoSuchMethodException e) {
			return null;
		}
	}

	/**
	 * Describes constructor parameters as dependencies keyed by their generic type and {@link Named} qualifier.
	 * Parameters annotated with {@link Optional} are not required.
	 */
	public static Dependency[] toDependencies(@NotNull Constructor<?> constructor) {
		Parameter[] parameters = constructor.getParameters();
		Type[] genericTypes = constructor.getGenericParameterTypes();
		// generic signature may omit synthetic parameters, fall back to the raw ones then
		boolean useGeneric = genericTypes.length == parameters.length;

		Dependency[] dependencies = new Dependency[parameters.length];
		for (int i = 0; i < parameters.length; i++) {
			Parameter parameter = parameters[i];
			Named named = parameter.getAnnotation(Named.class);
			Type type = useGeneric ? genericTypes[i] : parameter.getParameterizedType();
			Key<Object> key = Key.ofType(type, named != null ? named.value() : null);
			dependencies[i] = new Dependency(parameter.getName(), key, !parameter.isAnnotationPresent(Optional.class));
		}
		return dependencies;
	}

	private static void checkInstantiable(Class<?> cls) {
		if (cls.isInterface() || Modifier.isAbstract(cls.getModifiers())) {
			throw new DIException("Cannot instantiate interface or abstract class " + cls.getName());
		}
		if (cls.getEnclosingClass() != null && !Modifier.isStatic(cls.getModifiers())) {
			throw new DIException("Cannot instantiate inner class " + cls.getName() + ", make it static");
		}
	}
}
