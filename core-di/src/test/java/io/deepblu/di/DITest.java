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

import io.deepblu.di.UseCases.*;
import io.deepblu.result.Result;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static io.deepblu.di.UseCases.USER_REPO;
import static io.deepblu.di.UseCases.USE_CASES;
import static org.junit.Assert.*;

public final class DITest {

	@Before
	public void setUp() {
		DI.bind(APIKey.class, UseCases::apiKeyFactory);
		DI.add(UserService.class);
		DI.bindAll(
				Binding.self(CreateUser.class),
				Binding.self(GetUser.class),
				Binding.of(USER_REPO, UserSQLRepo.class),
				Binding.self(CommandBus.class));
		DI.provideMany(USE_CASES, CreateUser.class, GetUser.class);
	}

	@Test
	public void facadeUsesGlobalRegistry() {
		assertSame(Registry.global(), DI.registry());
		assertTrue(Registry.global().hasBinding(UserService.class));
		assertSame(DI.get(UserService.class), Registry.global().get(UserService.class));
	}

	@Test
	public void getResolvesInjectedInstances() throws Exception {
		UserService service = DI.get(UserService.class);
		assertEquals("John", service.getUser("1").toCompletableFuture().get().name);
		assertEquals("some-random-apikey", DI.get(APIKey.class).key);
		assertSame(DI.get(USER_REPO), service.repo);
	}

	@Test
	public void injectableConstructsWithInjectedParameters() throws Exception {
		Provider<UserController> controllers = DI.injectable(UserController.class);

		UserController controller = controllers.create();
		assertEquals("some-random-apikey", controller.apiKey);
		assertEquals("John", controller.getUser("1").toCompletableFuture().get().name);

		UserController other = controllers.create();
		assertNotSame(controller, other);
		assertSame(controller.service, other.service);
	}

	@Test
	public void explicitArgumentsOverrideBindings() {
		Injected<UserController> controllers = DI.injectable(UserController.class);

		UserController controller = controllers.with("apiKey", new APIKey("explicit")).call();
		assertEquals("explicit", controller.apiKey);
	}

	@Test
	public void bindInjectableByClass() {
		Injectable<APIKey> apiKey = Injectable.builder("apiKey")
				.with("suffix", Key.of(String.class, "suffix"))
				.build(args -> new APIKey("key-" + args.get("suffix")));
		DI.bind(Key.of(String.class, "suffix"), () -> "42");
		DI.bind(APIKey.class, apiKey);

		assertEquals("key-42", DI.get(APIKey.class).key);
		assertEquals("key-42", DI.injectable(UserController.class).create().apiKey);
	}

	@Test
	public void injectFunction() throws Exception {
		Injected<UseCase<CreateUserRequest, User>> injected = DI.inject(UseCases.CREATE_USER_USECASE);

		User user = injected.call().run(new CreateUserRequest("1", "John")).toCompletableFuture().get();
		assertEquals("John", user.name);
		assertTrue(((UserSQLRepo) DI.get(USER_REPO)).saved.contains(user));
	}

	@Test
	public void manualConstructionBypassesContainer() throws Exception {
		UserSQLRepo repo = new UserSQLRepo();
		CreateUser createUser = new CreateUser(repo);

		User user = createUser.run(new CreateUserRequest("1", "John")).toCompletableFuture().get();
		assertEquals("John", user.name);
		assertEquals(1, repo.saved.size());
	}

	@Test
	public void commandBusReceivesUseCasesInOrder() throws Exception {
		CommandBus bus = DI.get(CommandBus.class);

		assertEquals(2, bus.useCases.size());
		assertTrue(bus.useCases.get(0) instanceof CreateUser);

		@SuppressWarnings("unchecked")
		UseCase<CreateUserRequest, User> createUser = (UseCase<CreateUserRequest, User>) bus.useCases.get(0);
		assertEquals("Jack", createUser.run(new CreateUserRequest("2", "Jack")).toCompletableFuture().get().name);

		List<UseCase<?, ?>> created = DI.create(USE_CASES);
		assertNotSame(bus.useCases, created);
	}

	@Test
	public void monadicUseCase() throws Exception {
		GetUser getUser = DI.get(GetUser.class);

		Result<User> found = getUser.run("1").toCompletableFuture().get();
		assertTrue(found.isOk());
		assertEquals("John", found.getValue().name);

		Result<User> failed = getUser.run("").toCompletableFuture().get();
		assertEquals(Result.error(new IllegalArgumentException("Empty id")), failed);
	}

	@Test
	public void userServiceCreatesUser() throws Exception {
		UserService service = DI.get(UserService.class);

		User user = service.createUser(new CreateUserRequest("3", "Jill")).toCompletableFuture().get();
		assertEquals("Jill", user.name);
	}
}
