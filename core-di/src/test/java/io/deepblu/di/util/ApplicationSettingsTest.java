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

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.*;

public final class ApplicationSettingsTest {
	private static final class Settings {
	}

	@After
	public void tearDown() {
		System.clearProperty(Settings.class.getName() + ".enabled");
		System.clearProperty("Settings.enabled");
		System.clearProperty("Settings.size");
	}

	@Test
	public void defaults() {
		assertFalse(ApplicationSettings.getBoolean(Settings.class, "enabled", false));
		assertEquals("10", ApplicationSettings.getString(Settings.class, "size", "10"));
	}

	@Test
	public void fullyQualifiedNameTakesPrecedence() {
		System.setProperty("Settings.enabled", "false");
		System.setProperty(Settings.class.getName() + ".enabled", "true");
		System.setProperty("Settings.size", "42");

		assertTrue(ApplicationSettings.getBoolean(Settings.class, "enabled", false));
		assertEquals(Integer.valueOf(42), ApplicationSettings.get((String s) -> Integer.valueOf(s), Settings.class, "size", 10));
		assertEquals("42", ApplicationSettings.getString(Settings.class, "size", null));
	}
}
