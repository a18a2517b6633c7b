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

package io.deepblu.di.error;

import io.deepblu.di.Dependency;
import org.jetbrains.annotations.NotNull;

/**
 * An injectable was called without a value for a required parameter,
 * and the parameter's key was not bound either.
 */
public final class MissingArgumentException extends DIException {
	@NotNull
	private final Dependency dependency;

	public MissingArgumentException(@NotNull String callable, @NotNull Dependency dependency) {
		super(callable + " is missing required argument '" + dependency.getName() + "' of " + dependency.getKey().getDisplayString());
		this.dependency = dependency;
	}

	@NotNull
	public Dependency getDependency() {
		return dependency;
	}
}
