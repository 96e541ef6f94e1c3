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
package edu.emory.mathcs.nlp.glove;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import edu.emory.mathcs.nlp.glove.corpus.TokenPair;
import edu.emory.mathcs.nlp.glove.matrix.SparseMatrix;
import edu.emory.mathcs.nlp.glove.util.ThreadUtils;

/**
 * Builds the symmetric co-occurrence matrix where each pair at distance {@code d} contributes {@code 1/d}.
 * Each worker fills a private matrix from its share of the pairs; the private matrices are summed once all workers finish.
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class CooccurrenceBuilder
{
	private final int thread_size;

	public CooccurrenceBuilder(int threadSize)
	{
		if (threadSize <= 0) throw new InvalidConfigurationException("threads", threadSize, "must be greater than 0");
		thread_size = threadSize;
	}

	/**
	 * @param vocabSize the number of words; every index in the pairs must be in {@code [0, vocabSize)}.
	 * @throws IllegalArgumentException if a pair refers to an index out of range or has a distance less than 1.
	 */
	public SparseMatrix build(List<TokenPair> pairs, int vocabSize)
	{
		List<BuildTask> tasks = new ArrayList<>(thread_size);
		int size = pairs.size(), begin, end;

		for (int t=0; t<thread_size; t++)
		{
			begin = (int)((long)size *  t    / thread_size);
			end   = (int)((long)size * (t+1) / thread_size);
			if (begin < end) tasks.add(new BuildTask(pairs.subList(begin, end), vocabSize));
		}

		SparseMatrix matrix = new SparseMatrix(vocabSize);
		for (SparseMatrix partial : ThreadUtils.invokeAll(thread_size, tasks)) matrix.addAll(partial);
		return matrix;
	}

	static class BuildTask implements Callable<SparseMatrix>
	{
		private final List<TokenPair> pairs;
		private final int vocab_size;

		BuildTask(List<TokenPair> pairs, int vocabSize)
		{
			this.pairs = pairs;
			vocab_size = vocabSize;
		}

		@Override
		public SparseMatrix call()
		{
			SparseMatrix matrix = new SparseMatrix(vocab_size);
			double weight;

			for (TokenPair pair : pairs)
			{
				if (pair.getDistance() < 1) throw new IllegalArgumentException("Distance must be at least 1: " + pair);
				weight = 1d / pair.getDistance();
				matrix.add(pair.getFirst(), pair.getSecond(), weight);
				matrix.add(pair.getSecond(), pair.getFirst(), weight);
			}

			return matrix;
		}
	}
}
