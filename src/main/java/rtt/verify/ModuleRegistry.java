package rtt.verify;

import rtt.runtime.ModuleHandle;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Binds at most one module under a well-known name at a time.
 *
 * {@link #install} blocks while another registration is open, which serialises verification runs.
 */
public final class ModuleRegistry {
	private final ReentrantLock lock = new ReentrantLock();
	private volatile Registration current;

	public Registration install(String moduleName, ModuleHandle module) {
		lock.lock();
		if (current != null) {
			// re-entrant install from the owning thread
			lock.unlock();
			throw new IllegalStateException("module '" + current.moduleName() + "' is already installed");
		}
		current = new Registration(moduleName, module);
		return current;
	}

	public final class Registration implements AutoCloseable {
		private final String moduleName;
		private final ModuleHandle module;
		private boolean closed;

		private Registration(String moduleName, ModuleHandle module) {
			this.moduleName = moduleName;
			this.module = module;
		}

		public String moduleName() {
			return moduleName;
		}

		public ModuleHandle module() {
			return module;
		}

		@Override
		public void close() {
			if (closed) {
				return;
			}
			closed = true;
			current = null;
			lock.unlock();
		}
	}
}
