package org.yadacoin.utils;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class NamedThreadFactory implements ThreadFactory {

	private final String name;
	private final AtomicInteger threadNumber = new AtomicInteger(1);

	public NamedThreadFactory(String name) {
		this.name = name;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread thread = Executors.defaultThreadFactory().newThread(runnable);
		thread.setName(this.name + "-" + this.threadNumber.getAndIncrement());
		thread.setDaemon(true);

		return thread;
	}

}
