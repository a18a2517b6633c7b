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

import io.deepblu.di.annotation.Inject;
import io.deepblu.result.Monadic;
import io.deepblu.result.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionStage;

import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * A small user-management application wired through the container.
 */
public final class UseCases {
	public static final Key<Repo<User>> USER_REPO = new Key<Repo<User>>() {};
	public static final Key<List<UseCase<?, ?>>> USE_CASES = new Key<List<UseCase<?, ?>>>() {};

	public static final Injectable<UseCase<CreateUserRequest, User>> CREATE_USER_USECASE = Injectable.builder("createUserUseCase")
			.with("repo", USER_REPO)
			.build(args -> {
				Repo<User> repo = args.get("repo");
				return request -> {
					User user = new User(request.id, request.name);
					return repo.save(user).thenApply($ -> user);
				};
			});

	private UseCases() {
	}

	public static final class User {
		public final String id;
		public final String name;

		public User(String id, String name) {
			this.id = id;
			this.name = name;
		}
	}

	public static final class CreateUserRequest {
		public final String id;
		public final String name;

		public CreateUserRequest(String id, String name) {
			this.id = id;
			this.name = name;
		}
	}

	public interface Repo<E> {
		CompletionStage<E> get(String id);

		CompletionStage<Void> save(E entity);
	}

	public static final class UserSQLRepo implements Repo<User> {
		public final List<User> saved = new ArrayList<>();

		@Override
		public CompletionStage<User> get(String id) {
			if (id.isEmpty()) {
				throw new IllegalArgumentException("Empty id");
			}
			return completedFuture(new User(id, "John"));
		}

		@Override
		public CompletionStage<Void> save(User entity) {
			saved.add(entity);
			return completedFuture(null);
		}
	}

	@FunctionalInterface
	public interface UseCase<Q, R> {
		CompletionStage<R> run(Q request);
	}

	public static final class CreateUser implements UseCase<CreateUserRequest, User> {
		public final Repo<User> repo;

		@Inject
		public CreateUser(Repo<User> repo) {
			this.repo = repo;
		}

		@Override
		public CompletionStage<User> run(CreateUserRequest request) {
			User user = new User(request.id, request.name);
			return repo.save(user).thenApply($ -> user);
		}
	}

	public static final class GetUser implements UseCase<String, Result<User>> {
		public final Repo<User> repo;

		@Inject
		public GetUser(Repo<User> repo) {
			this.repo = repo;
		}

		@Override
		public CompletionStage<Result<User>> run(String id) {
			return Monadic.callAsync(() -> repo.get(id));
		}
	}

	public static final class UserService {
		public final Repo<User> repo;
		public final CreateUser createUserUseCase;

		@Inject
		public UserService(Repo<User> repo, CreateUser createUserUseCase) {
			this.repo = repo;
			this.createUserUseCase = createUserUseCase;
		}

		public CompletionStage<User> createUser(CreateUserRequest request) {
			return createUserUseCase.run(request)
					.thenCompose(user -> repo.save(user).thenApply($ -> user));
		}

		public CompletionStage<User> getUser(String id) {
			return repo.get(id);
		}
	}

	public static final class APIKey {
		public final String key;

		public APIKey(String key) {
			this.key = key;
		}
	}

	public static APIKey apiKeyFactory() {
		return new APIKey("some-random-apikey");
	}

	public static final class UserController {
		public final UserService service;
		public final String apiKey;

		@Inject
		public UserController(UserService service, APIKey apiKey) {
			this.service = service;
			this.apiKey = apiKey.key;
		}

		public CompletionStage<User> getUser(String id) {
			return service.getUser(id);
		}
	}

	public static final class CommandBus {
		public final List<UseCase<?, ?>> useCases;

		@Inject
		public CommandBus(List<UseCase<?, ?>> useCases) {
			this.useCases = useCases;
		}
	}
}
