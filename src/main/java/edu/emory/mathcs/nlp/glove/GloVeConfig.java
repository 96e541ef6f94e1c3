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

import org.kohsuke.args4j.Option;

/**
 * Training and corpus options of a {@link GloVe} model.
 * The fields double as command line options so the tools under {@code bin} can populate them directly.
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class GloVeConfig
{
	static public final double DEFAULT_MAX_COUNT     = 100;
	static public final double DEFAULT_LEARNING_RATE = 0.05;
	static public final double DEFAULT_ALPHA         = 0.75;
	static public final int    DEFAULT_VECTOR_SIZE   = 30;
	static public final int    DEFAULT_EPOCHS        = 5;
	static public final int    DEFAULT_THREAD_SIZE   = 4;
	static public final int    DEFAULT_WINDOW        = 2;
	static public final int    DEFAULT_MIN_COUNT     = 5;
	static public final long   DEFAULT_SEED          = 1;

	@Option(name="-max-count", usage="cutoff of the weighting function (default: 100).", required=false, metaVar="<double>")
	double max_count = DEFAULT_MAX_COUNT;
	@Option(name="-learning-rate", usage="initial learning rate (default: 0.05).", required=false, metaVar="<double>")
	double learning_rate = DEFAULT_LEARNING_RATE;
	@Option(name="-alpha", usage="exponent of the weighting function (default: 0.75).", required=false, metaVar="<double>")
	double alpha = DEFAULT_ALPHA;
	@Option(name="-size", usage="size of word vectors (default: 30).", required=false, metaVar="<int>")
	int vector_size = DEFAULT_VECTOR_SIZE;
	@Option(name="-iter", usage="number of training epochs (default: 5).", required=false, metaVar="<int>")
	int epochs = DEFAULT_EPOCHS;
	@Option(name="-threads", usage="number of threads used to build the co-occurrence matrix and to train (default: 4).", required=false, metaVar="<int>")
	int thread_size = DEFAULT_THREAD_SIZE;
	@Option(name="-window", usage="max-window of contextual words (default: 2).", required=false, metaVar="<int>")
	int window = DEFAULT_WINDOW;
	@Option(name="-min-count", usage="min-count of words (default: 5). This will discard words that appear less than <int> times.", required=false, metaVar="<int>")
	int min_count = DEFAULT_MIN_COUNT;
	@Option(name="-update-mode", usage="HOGWILD for lock-free updates, DETERMINISTIC for row-disjoint rounds that give the same result for any number of threads (default: HOGWILD).", required=false, metaVar="<mode>")
	UpdateMode update_mode = UpdateMode.HOGWILD;
	@Option(name="-seed", usage="nonzero seed of the random initialization and the epoch shuffles (default: 1).", required=false, metaVar="<long>")
	long seed = DEFAULT_SEED;

	/**
	 * @throws InvalidConfigurationException if any option is out of range.
	 * @return this configuration.
	 */
	public GloVeConfig validate()
	{
		if (thread_size <= 0)            throw new InvalidConfigurationException("threads", thread_size, "must be greater than 0");
		if (vector_size <= 0)            throw new InvalidConfigurationException("size", vector_size, "must be greater than 0");
		if (!(max_count > 0))            throw new InvalidConfigurationException("max-count", max_count, "must be greater than 0");
		if (!(learning_rate > 0))        throw new InvalidConfigurationException("learning-rate", learning_rate, "must be greater than 0");
		if (!(alpha > 0 && alpha <= 1))  throw new InvalidConfigurationException("alpha", alpha, "must be in (0, 1]");
		if (epochs < 0)                  throw new InvalidConfigurationException("iter", epochs, "must not be negative");
		if (window <= 0)                 throw new InvalidConfigurationException("window", window, "must be greater than 0");
		if (min_count < 0)               throw new InvalidConfigurationException("min-count", min_count, "must not be negative");
		if (update_mode == null)         throw new InvalidConfigurationException("update-mode", null, "must be set");
		if (seed == 0)                   throw new InvalidConfigurationException("seed", seed, "must not be 0");
		return this;
	}

	public double getMaxCount()
	{
		return max_count;
	}

	public GloVeConfig setMaxCount(double maxCount)
	{
		max_count = maxCount;
		return this;
	}

	public double getLearningRate()
	{
		return learning_rate;
	}

	public GloVeConfig setLearningRate(double learningRate)
	{
		learning_rate = learningRate;
		return this;
	}

	public double getAlpha()
	{
		return alpha;
	}

	public GloVeConfig setAlpha(double alpha)
	{
		this.alpha = alpha;
		return this;
	}

	public int getVectorSize()
	{
		return vector_size;
	}

	public GloVeConfig setVectorSize(int vectorSize)
	{
		vector_size = vectorSize;
		return this;
	}

	public int getEpochs()
	{
		return epochs;
	}

	public GloVeConfig setEpochs(int epochs)
	{
		this.epochs = epochs;
		return this;
	}

	public int getThreadSize()
	{
		return thread_size;
	}

	public GloVeConfig setThreadSize(int threadSize)
	{
		thread_size = threadSize;
		return this;
	}

	public int getWindow()
	{
		return window;
	}

	public GloVeConfig setWindow(int window)
	{
		this.window = window;
		return this;
	}

	public int getMinCount()
	{
		return min_count;
	}

	public GloVeConfig setMinCount(int minCount)
	{
		min_count = minCount;
		return this;
	}

	public UpdateMode getUpdateMode()
	{
		return update_mode;
	}

	public GloVeConfig setUpdateMode(UpdateMode mode)
	{
		update_mode = mode;
		return this;
	}

	public long getSeed()
	{
		return seed;
	}

	public GloVeConfig setSeed(long seed)
	{
		this.seed = seed;
		return this;
	}

	@Override
	public String toString()
	{
		return String.format("max-count=%s, learning-rate=%s, alpha=%s, size=%d, iter=%d, threads=%d, window=%d, min-count=%d, update-mode=%s, seed=%d",
				max_count, learning_rate, alpha, vector_size, epochs, thread_size, window, min_count, update_mode, seed);
	}
}
