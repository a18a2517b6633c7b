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

public final class UnboundKeyException extends DIException {
	@NotNull
	private final Key<?> key;

	public UnboundKeyException(@NotNull Key<?> key) {
		super("No binding for key " + key.getDisplayString());
		this.key = key;
	}

	@NotNull
	public Key<?> getKey() {
		return key;
	}
}
