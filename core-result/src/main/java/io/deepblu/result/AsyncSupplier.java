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

package io.deepblu.result;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous counterpart of {@link ThrowingSupplier}. The operation may fail either
 * by throwing right away or by completing the returned stage exceptionally.
 */
@FunctionalInterface
public interface AsyncSupplier<T> {
	CompletionStage<T> get() throws Exception;
}
