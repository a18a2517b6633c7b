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

import io.deepblu.di.Key;
import org.jetbrains.annotations.NotNull;

import java.util.List;

import static java.util.stream.Collectors.joining;

public final class CyclicDependencyException extends DIException {
	@NotNull
	private final List<Key<?>> cycle;

	public CyclicDependencyException(@NotNull List<Key<?>> cycle) {
		super("Cyclic dependency detected: " + cycle.stream().map(Key::getDisplayString).collect(joining(" -> ")));
		this.cycle = cycle;
	}

	/**
	 * Keys of the cycle in resolution order, the first key repeated at the end.
	 */
	@NotNull
	public List<Key<?>> getCycle() {
		return cycle;
	}
}
