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

import io.deepblu.di.Injectable;
import io.deepblu.di.Registry;
import io.deepblu.di.error.DIException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

public final class Modules {
	private static final Logger logger = LoggerFactory.getLogger(Modules.class);

	private Modules() {
		throw new AssertionError();
	}

	public static <M extends Module> M register(@NotNull Class<M> type) {
		return register(Registry.global(), type);
	}

	/**
	 * Instantiates the module through its no-argument constructor and binds its own providers into the registry.
	 * Registering a type that is already registered in the registry binds nothing.
	 *
	 * @return the module instance, resolving in the given registry
	 */
	public static <M extends Module> M register(@NotNull Registry registry, @NotNull Class<M> type) {
		return register(registry, instantiate(type));
	}

	public static <M extends Module> M register(@NotNull Registry registry, @NotNull M module) {
		checkNotNull(registry);
		Class<?> type = module.getClass();
		if (registry.isRegistered(type)) {
			logger.debug("Module {} is already registered", type.getName());
		} else {
			registry.bindAll(module.getProviders());
			registry.markRegistered(type);
			logger.debug("Registered module {} with {} providers", type.getName(), module.getProviders().size());
		}
		if (module instanceof AbstractModule) {
			((AbstractModule) module).attachTo(registry);
		}
		return module;
	}

	public static <M extends Module> M registerWithImports(@NotNull Class<M> type) {
		return registerWithImports(Registry.global(), type);
	}

	/**
	 * Registers the module together with every module it imports, directly or transitively.
	 * Imported modules are registered before the modules importing them.
	 */
	@SuppressWarnings("unchecked")
	public static <M extends Module> M registerWithImports(@NotNull Registry registry, @NotNull Class<M> type) {
		List<Class<? extends Module>> types = importsOf(type);
		logger.info("Registering {} with its imports {}", type.getName(), types.subList(0, types.size() - 1));
		M root = null;
		for (Class<? extends Module> moduleType : types) {
			Module module = register(registry, moduleType);
			if (moduleType == type) {
				root = (M) module;
			}
		}
		return checkNotNull(root);
	}

	/**
	 * Returns the module type with all its direct and transitive imports, depth first,
	 * every type once and imports before the modules importing them. Import cycles are tolerated.
	 */
	public static List<Class<? extends Module>> importsOf(@NotNull Class<? extends Module> type) {
		List<Class<? extends Module>> result = new ArrayList<>();
		collectImports(checkNotNull(type), new HashSet<>(), result);
		return result;
	}

	private static void collectImports(Class<? extends Module> type, Set<Class<? extends Module>> visited, List<Class<? extends Module>> result) {
		if (!visited.add(type)) {
			return;
		}
		for (Class<? extends Module> imported : instantiate(type).getImports()) {
			collectImports(imported, visited, result);
		}
		result.add(type);
	}

	private static <M extends Module> M instantiate(Class<M> type) {
		Injectable<M> constructor = Injectable.ofConstructor(type);
		if (!constructor.getDependencies().isEmpty()) {
			throw new DIException("Module " + type.getName() + " must be constructed without arguments");
		}
		return constructor.call(Registry.create());
	}
}
