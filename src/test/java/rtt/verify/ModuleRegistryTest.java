package rtt.verify;

import org.junit.jupiter.api.Test;
import rtt.runtime.ModuleHandle;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModuleRegistryTest {
	@Test
	void registrationCarriesTheInstalledModule() {
		ModuleRegistry registry = new ModuleRegistry();
		ModuleHandle module = new ModuleHandle("original");

		try (ModuleRegistry.Registration registration = registry.install("original", module)) {
			assertSame(module, registration.module());
			assertEquals("original", registration.moduleName());
		}

		assertReleased(registry);
	}

	@Test
	void secondInstallFromSameThreadFails() {
		ModuleRegistry registry = new ModuleRegistry();

		try (ModuleRegistry.Registration ignored = registry.install("original", new ModuleHandle("original"))) {
			var ex = assertThrows(IllegalStateException.class,
					() -> registry.install("original", new ModuleHandle("original")));
			assertTrue(ex.getMessage().contains("original"));
		}
		assertReleased(registry);
	}

	@Test
	void closingTwiceReleasesOnce() {
		ModuleRegistry registry = new ModuleRegistry();

		ModuleRegistry.Registration registration = registry.install("original", new ModuleHandle("original"));
		registration.close();
		registration.close();

		assertReleased(registry);
	}

	@Test
	void secondInstallFromOtherThreadWaits() throws Exception {
		ModuleRegistry registry = new ModuleRegistry();
		CountDownLatch installed = new CountDownLatch(1);

		ModuleRegistry.Registration first = registry.install("original", new ModuleHandle("original"));
		Thread other = new Thread(() -> {
			try (ModuleRegistry.Registration ignored = registry.install("original", new ModuleHandle("original"))) {
				installed.countDown();
			}
		});
		other.start();

		assertFalse(installed.await(200, TimeUnit.MILLISECONDS));
		first.close();
		assertTrue(installed.await(5, TimeUnit.SECONDS));
		other.join(5_000);
		assertReleased(registry);
	}

	/**
	 * A registry held by this thread rejects the install; one held elsewhere would block instead.
	 */
	static void assertReleased(ModuleRegistry registry) {
		assertDoesNotThrow(() -> registry.install("check", new ModuleHandle("check")).close());
	}
}
