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
import io.deepblu.di.annotation.Inject;
import io.deepblu.di.annotation.Named;
import io.deepblu.di.annotation.Optional;
import io.deepblu.di.error.DIException;
import io.deepblu.di.error.MissingArgumentException;
import io.deepblu.di.error.ProvisionException;
import org.junit.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.deepblu.di.UseCases.USER_REPO;
import static java.util.Arrays.asList;
import static java.util.Collections.singletonMap;
import static org.junit.Assert.*;

public final class InjectableTest {
	private static final Injectable<String> GREETING = Injectable.builder("greeting")
			.with("name", String.class)
			.withOptional("punctuation", Key.of(String.class, "punctuation"))
			.build(args -> "Hello, " + args.get("name") + args.getOr("punctuation", "."));

	@Test
	public void resolvesBoundParameters() {
		Registry registry = Registry.create()
				.bind(String.class, () -> "John")
				.bind(Key.of(String.class, "punctuation"), () -> "!");

		assertEquals("Hello, John!", GREETING.call(registry));
	}

	@Test
	public void explicitArgumentWins() {
		Registry registry = Registry.create()
				.bind(String.class, () -> "John");

		assertEquals("Hello, Jane.", GREETING.call(registry, singletonMap("name", "Jane")));
		assertFalse(registry.hasInstance(String.class));

		Map<String, Object> arguments = new HashMap<>();
		arguments.put("name", "Jack");
		arguments.put("punctuation", null);
		assertEquals("Hello, Jacknull", GREETING.call(registry, arguments));
	}

	@Test
	public void unexpectedArgumentIsRejected() {
		try {
			GREETING.call(Registry.create(), singletonMap("surname", "Doe"));
			fail("should've failed");
		} catch (IllegalArgumentException e) {
			assertEquals("Unexpected argument 'surname' for greeting", e.getMessage());
		}
	}

	@Test
	public void missingRequiredArgumentFailsOnRead() {
		try {
			GREETING.call(Registry.create());
			fail("should've failed");
		} catch (MissingArgumentException e) {
			assertEquals("name", e.getDependency().getName());
		}
	}

	@Test
	public void unboundOptionalArgumentIsAbsent() {
		Injectable<Boolean> injectable = Injectable.builder("check")
				.withOptional("value", Integer.class)
				.build(args -> args.has("value"));

		assertFalse(injectable.call(Registry.create()));
		assertTrue(injectable.call(Registry.create().bind(Integer.class, () -> 1)));

		Arguments arguments = injectable.resolve(Registry.create(), singletonMap("value", 2));
		assertEquals(2, (int) arguments.get("value"));
		assertEquals(singletonMap("value", 2), arguments.asMap());
		try {
			arguments.get("other");
			fail("should've failed");
		} catch (IllegalArgumentException ignored) {
		}
	}

	@Test
	public void duplicateParametersAreRejected() {
		try {
			Injectable.builder("twice")
					.with("x", String.class)
					.with("x", Integer.class)
					.build(args -> null);
			fail("should've failed");
		} catch (IllegalArgumentException e) {
			assertEquals("Duplicate parameter 'x' in twice", e.getMessage());
		}
	}

	@Test
	public void injectionIsNotTransitive() throws Exception {
		Registry registry = Registry.create()
				.bind(USER_REPO, UserSQLRepo.class);
		Injectable<UseCase<CreateUserRequest, User>> injectable = UseCases.CREATE_USER_USECASE;

		// the injectable resolves its own parameters, the repo is constructed by its own binding
		User user = injectable.call(registry).run(new CreateUserRequest("1", "John")).toCompletableFuture().get();
		assertEquals("John", user.name);

		try {
			Injectable.ofConstructor(UserService.class).call(registry);
			fail("should've failed");
		} catch (MissingArgumentException e) {
			assertEquals("createUserUseCase", e.getDependency().getName());
		}
	}

	@Test
	public void constructorDependencies() {
		Injectable<UserService> injectable = Injectable.ofConstructor(UserService.class);

		assertSame(injectable, Injectable.ofConstructor(UserService.class));
		assertEquals("UseCases$UserService", injectable.getDisplayName());
		assertEquals(asList(
				new Dependency("repo", USER_REPO, true),
				new Dependency("createUserUseCase", Key.of(CreateUser.class), true)),
				injectable.getDependencies());
	}

	@Test
	public void namedAndOptionalConstructorParameters() {
		Registry registry = Registry.create()
				.bind(Key.of(String.class, "greeting"), () -> "Hi");

		Greeter greeter = Injectable.ofConstructor(Greeter.class).call(registry);
		assertEquals("Hi", greeter.greeting);
		assertNull(greeter.times);

		registry.bind(Integer.class, () -> 3);
		greeter = Injectable.ofConstructor(Greeter.class).call(registry);
		assertEquals(3, greeter.times.intValue());

		List<Dependency> dependencies = Injectable.ofConstructor(Greeter.class).getDependencies();
		assertEquals(Key.of(String.class, "greeting"), dependencies.get(0).getKey());
		assertFalse(dependencies.get(1).isRequired());
	}

	@Test
	public void injectAnnotatedType() {
		Registry registry = Registry.create()
				.bind(String.class, () -> "value");

		assertEquals("value", Injectable.ofConstructor(AnnotatedType.class).call(registry).value);
	}

	@Test
	public void noArgumentConstructorFallback() {
		Injectable<Plain> injectable = Injectable.ofConstructor(Plain.class);

		assertTrue(injectable.getDependencies().isEmpty());
		assertNotNull(injectable.call(Registry.create()));
	}

	@Test
	public void uninstantiableClasses() {
		for (Class<?> cls : new Class<?>[]{Repo.class, NoSuitableConstructor.class, TwoInjectConstructors.class, Inner.class}) {
			try {
				Injectable.ofConstructor(cls);
				fail("should've failed for " + cls);
			} catch (DIException ignored) {
			}
		}
	}

	@Test
	public void constructorFailures() {
		try {
			Injectable.ofConstructor(FailingChecked.class).call(Registry.create());
			fail("should've failed");
		} catch (ProvisionException e) {
			assertTrue(e.getCause() instanceof IOException);
		}

		try {
			Injectable.ofConstructor(FailingUnchecked.class).call(Registry.create());
			fail("should've failed");
		} catch (IllegalStateException e) {
			assertEquals("unchecked", e.getMessage());
		}
	}

	@Test
	public void injectedWithExplicitArguments() {
		Registry registry = Registry.create()
				.bind(String.class, () -> "John");
		Injected<String> injected = GREETING.bindTo(registry);

		assertEquals("Hello, John.", injected.create());
		assertEquals("Hello, Jane.", injected.with("name", "Jane").call());
		assertEquals("Hello, Jane?", injected.with("name", "Jane").call(singletonMap("punctuation", "?")));
		assertEquals("Hello, John.", injected.call());
		assertSame(registry, injected.getRegistry());
		assertSame(GREETING, injected.getInjectable());
	}

	public static final class Greeter {
		final String greeting;
		final Integer times;

		@Inject
		public Greeter(@Named("greeting") String greeting, @Optional Integer times) {
			this.greeting = greeting;
			this.times = times;
		}
	}

	@Inject
	public static final class AnnotatedType {
		final String value;

		public AnnotatedType(String value) {
			this.value = value;
		}
	}

	public static final class Plain {
	}

	public static final class NoSuitableConstructor {
		public NoSuitableConstructor(String value) {
		}
	}

	public static final class TwoInjectConstructors {
		@Inject
		public TwoInjectConstructors(String value) {
		}

		@Inject
		public TwoInjectConstructors(Integer value) {
		}
	}

	public final class Inner {
	}

	public static final class FailingChecked {
		public FailingChecked() throws IOException {
			throw new IOException("checked");
		}
	}

	public static final class FailingUnchecked {
		public FailingUnchecked() {
			throw new IllegalStateException("unchecked");
		}
	}
}
