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
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import edu.emory.mathcs.nlp.glove.matrix.SparseMatrix;
import edu.emory.mathcs.nlp.glove.util.BinUtils;
import edu.emory.mathcs.nlp.glove.util.ThreadUtils;

/**
 * Fits word vectors and biases to the log co-occurrence counts with AdaGrad.
 * Each epoch shuffles the nonzero cells and returns only after every cell has been applied.
 * In {@link UpdateMode#HOGWILD}, the cells are split into one contiguous chunk per thread.
 * In {@link UpdateMode#DETERMINISTIC}, they are split into rounds in which no two cells share a row.
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 * https://nlp.stanford.edu/pubs/glove.pdf
 */
public class Trainer
{
	public enum State {NOT_STARTED, RUNNING, DONE, ABORTED}

	/** Every gradient component is clipped to {@code [-GRADIENT_CLIP, GRADIENT_CLIP]}. */
	static public final double GRADIENT_CLIP = 100;

	private final GloVeConfig config;
	private final Random      rand;
	private volatile State    state;
	private volatile int      epoch;

	public Trainer(GloVeConfig config, Random rand)
	{
		this.config = config.validate();
		this.rand   = rand;
		state = State.NOT_STARTED;
	}

	public State getState()
	{
		return state;
	}

	/** @return the last epoch fully applied; 0 before the first epoch completes. */
	public int getEpoch()
	{
		return epoch;
	}

	/** Same as {@link #train(VectorSpace, SparseMatrix, long[])} over every nonzero cell of the matrix. */
	public double[] train(VectorSpace space, SparseMatrix matrix)
	{
		return train(space, matrix, matrix.nonZeroEntries());
	}

	/**
	 * Updates the vector space in place.
	 * If a worker fails, the space is restored to the end of the last completed epoch and the failure is rethrown.
	 * @param entries packed coordinates of the nonzero cells (see {@link SparseMatrix#pack(int, int)}); shuffled in place every epoch.
	 * @return the mean weighted cost of each epoch.
	 * @throws IllegalArgumentException if a cell is out of range or its count is not positive.
	 */
	public double[] train(VectorSpace space, SparseMatrix matrix, long[] entries)
	{
		if (state != State.NOT_STARTED) throw new IllegalStateException("A trainer can be run only once: " + state);
		if (space.getVocabularySize() != matrix.size())
			throw new DataIntegrityException("Vocabulary size mismatch: vectors " + space.getVocabularySize() + ", matrix " + matrix.size());

		double[] costs = new double[config.getEpochs()];
		double[] cell_costs = new double[entries.length];
		state = State.RUNNING;

		for (int e=0; e<config.getEpochs(); e++)
		{
			VectorSpace snapshot = space.copy();
			shuffle(entries);

			try
			{
				if (config.getUpdateMode() == UpdateMode.DETERMINISTIC)
					runRounds(space, matrix, entries, cell_costs);
				else
					runChunks(space, matrix, entries, cell_costs);
			}
			catch (RuntimeException | Error x)
			{
				space.copyFrom(snapshot);
				state = State.ABORTED;
				throw x;
			}

			costs[e] = mean(cell_costs);
			epoch = e + 1;
			BinUtils.LOG.info(String.format("- epoch = %03d, cost = %.6f", epoch, costs[e]));
		}

		state = State.DONE;
		return costs;
	}

	/** One contiguous chunk per thread; blocks until every chunk has been applied. */
	private void runChunks(VectorSpace space, SparseMatrix matrix, long[] entries, double[] cellCosts)
	{
		int thread_size = config.getThreadSize(), begin, end;
		List<TrainTask> tasks = new ArrayList<>(thread_size);

		for (int t=0; t<thread_size; t++)
		{
			begin = (int)((long)entries.length *  t    / thread_size);
			end   = (int)((long)entries.length * (t+1) / thread_size);
			if (begin < end) tasks.add(new TrainTask(space, matrix, entries, null, cellCosts, begin, end));
		}

		ThreadUtils.invokeAll(thread_size, tasks);
	}

	/**
	 * Applies the rounds of {@link #schedule(long[], int, int[])} one after another;
	 * the cells of a round touch disjoint rows, so they are split across threads without changing the result.
	 */
	private void runRounds(VectorSpace space, SparseMatrix matrix, long[] entries, double[] cellCosts)
	{
		int thread_size = config.getThreadSize();
		int[] order = new int[entries.length];
		int[] rounds = schedule(entries, matrix.size(), order);
		ExecutorService executor = Executors.newFixedThreadPool(thread_size);

		try
		{
			for (int r=0; r+1<rounds.length; r++)
			{
				int size = rounds[r+1] - rounds[r], chunks = Math.min(thread_size, size), begin, end;
				List<TrainTask> tasks = new ArrayList<>(chunks);

				for (int t=0; t<chunks; t++)
				{
					begin = rounds[r] + (int)((long)size *  t    / chunks);
					end   = rounds[r] + (int)((long)size * (t+1) / chunks);
					tasks.add(new TrainTask(space, matrix, entries, order, cellCosts, begin, end));
				}

				if (chunks == 1) tasks.get(0).call();
				else ThreadUtils.invokeAll(executor, tasks);
			}
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	/**
	 * Assigns every cell to the earliest round after the last round touching either of its rows,
	 * so each row receives its updates in the shuffled order.
	 * @param order filled with the indices of the cells grouped by round.
	 * @return offsets of the rounds in {@code order}; round {@code r} is {@code [offsets[r], offsets[r+1])}.
	 * @throws IllegalArgumentException if a cell is out of {@code [0, size)}.
	 */
	static int[] schedule(long[] entries, int size, int[] order)
	{
		int[] round = new int[entries.length];
		int[] next  = new int[size];	// first round a row is free again
		int i, j, k, r, round_size = 0;

		for (k=0; k<entries.length; k++)
		{
			i = SparseMatrix.row(entries[k]);
			j = SparseMatrix.column(entries[k]);

			if (i < 0 || i >= size || j < 0 || j >= size)
				throw new IllegalArgumentException(String.format("Cell (%d, %d) out of [0, %d)", i, j, size));

			r = Math.max(next[i], next[j]);
			round[k] = r;
			next[i] = next[j] = r + 1;
			round_size = Math.max(round_size, r + 1);
		}

		int[] offsets = new int[round_size + 1];
		for (k=0; k<entries.length; k++) offsets[round[k]+1]++;
		for (r=0; r<round_size; r++) offsets[r+1] += offsets[r];

		int[] fill = offsets.clone();
		for (k=0; k<entries.length; k++) order[fill[round[k]]++] = k;
		return offsets;
	}

	/** Sums in index order so the result does not depend on how the cells were split. */
	static private double mean(double[] cellCosts)
	{
		double sum = 0;
		for (double c : cellCosts) sum += c;
		return cellCosts.length > 0 ? sum / cellCosts.length : 0;
	}

	/** Fisher-Yates shuffle. */
	void shuffle(long[] entries)
	{
		int i, j;
		long t;

		for (i=entries.length-1; i>0; i--)
		{
			j = rand.nextInt(i+1);
			t = entries[i];
			entries[i] = entries[j];
			entries[j] = t;
		}
	}

	/** @return {@code (count / max_count)^alpha} if the count is less than {@code max_count}; otherwise, 1. */
	static public double weight(double count, double maxCount, double alpha)
	{
		return (count < maxCount) ? Math.pow(count / maxCount, alpha) : 1;
	}

	static double clip(double gradient)
	{
		return Math.max(-GRADIENT_CLIP, Math.min(GRADIENT_CLIP, gradient));
	}

	class TrainTask implements Callable<Void>
	{
		private final VectorSpace  space;
		private final SparseMatrix matrix;
		private final long[]       entries;
		private final int[]        order;
		private final double[]     cell_costs;
		private final int          begin;
		private final int          end;

		/** @param order maps positions in {@code [begin, end)} to cell indices; {@code null} for the identity. */
		TrainTask(VectorSpace space, SparseMatrix matrix, long[] entries, int[] order, double[] cellCosts, int begin, int end)
		{
			this.space   = space;
			this.matrix  = matrix;
			this.entries = entries;
			this.order   = order;
			cell_costs   = cellCosts;
			this.begin   = begin;
			this.end     = end;
		}

		@Override
		public Void call()
		{
			int i, j, k;
			double count;

			for (int p=begin; p<end; p++)
			{
				k = (order == null) ? p : order[p];
				i = SparseMatrix.row(entries[k]);
				j = SparseMatrix.column(entries[k]);
				count = matrix.get(i, j);

				if (!(count > 0))
					throw new IllegalArgumentException(String.format("Cell (%d, %d) has a non-positive count: %s", i, j, count));

				cell_costs[k] = update(i, j, count);
			}

			return null;
		}

		/** @return the weighted cost of the cell before the update. */
		private double update(int i, int j, double count)
		{
			final int    vector_size = space.getVectorSize();
			final double rate = config.getLearningRate();
			double[] W  = space.getWordVectors().getArray();
			double[] B  = space.getBiases().getArray();
			double[] GW = space.getWordGradientSquares().getArray();
			double[] GB = space.getBiasGradientSquares().getArray();
			int l1 = i * vector_size, l2 = j * vector_size, k;
			double diff = B[i] + B[j] - Math.log(count), fdiff, g1, g2;

			for (k=0; k<vector_size; k++)
				diff += W[l1+k] * W[l2+k];

			fdiff = weight(count, config.getMaxCount(), config.getAlpha()) * diff;

			for (k=0; k<vector_size; k++)
			{
				g1 = clip(fdiff * W[l2+k]);
				g2 = clip(fdiff * W[l1+k]);
				GW[l1+k] += g1 * g1;
				GW[l2+k] += g2 * g2;
				W[l1+k] -= rate * g1 / Math.sqrt(GW[l1+k]);
				W[l2+k] -= rate * g2 / Math.sqrt(GW[l2+k]);
			}

			g1 = clip(fdiff);
			GB[i] += g1 * g1;
			B[i] -= rate * g1 / Math.sqrt(GB[i]);
			GB[j] += g1 * g1;
			B[j] -= rate * g1 / Math.sqrt(GB[j]);

			return 0.5 * fdiff * diff;
		}
	}
}
