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

import io.deepblu.di.Binding;
import io.deepblu.di.Key;
import io.deepblu.di.Registry;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A named group of bindings with metadata about the modules it builds upon.
 * <p>
 * Registering a module with {@link Modules#register(Registry, Class)} binds its own
 * {@link #getProviders() providers} into a registry. Imported modules are not registered along with it,
 * use {@link Modules#registerWithImports(Registry, Class)} to register the whole import tree.
 */
public interface Module {
	@NotNull
	List<Class<? extends Module>> getImports();

	@NotNull
	List<Binding<?>> getProviders();

	@NotNull
	List<Class<? extends Module>> getExports();

	/**
	 * Returns the registry this module was registered in, or the global one for an unregistered module.
	 */
	@NotNull
	Registry getRegistry();

	/**
	 * Resolves a key in the registry of this module. Resolution is not restricted to the bindings of this module.
	 */
	default <T> T get(@NotNull Key<T> key) {
		return getRegistry().get(key);
	}

	default <T> T get(@NotNull Class<T> type) {
		return getRegistry().get(type);
	}
}
