/**
 * Copyright 2015, Emory University
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.emory.mathcs.nlp.glove.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import edu.emory.mathcs.nlp.glove.GloVeException;

/**
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class ThreadUtils
{
	private ThreadUtils() {}

	/**
	 * Runs all tasks on a fixed pool of {@code threadSize} workers and blocks until every task completes.
	 * The first task failure is rethrown after all tasks have finished.
	 * @return the results in the order of the tasks.
	 */
	static public <T> List<T> invokeAll(int threadSize, List<? extends Callable<T>> tasks)
	{
		if (tasks.isEmpty()) return new ArrayList<>();
		ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadSize, tasks.size()));

		try
		{
			return invokeAll(executor, tasks);
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	/**
	 * Same as {@link #invokeAll(int, List)} on an executor owned by the caller, which is left running.
	 */
	static public <T> List<T> invokeAll(ExecutorService executor, List<? extends Callable<T>> tasks)
	{
		List<T> results = new ArrayList<>(tasks.size());

		try
		{
			for (Future<T> future : executor.invokeAll(tasks))
				results.add(future.get());
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new GloVeException("Interrupted while waiting for workers", e);
		}
		catch (ExecutionException e)
		{
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) throw (RuntimeException)cause;
			if (cause instanceof Error) throw (Error)cause;
			throw new GloVeException("Worker failed", cause);
		}

		return results;
	}
}
