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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Random;

import edu.emory.mathcs.nlp.common.random.XORShiftRandom;
import edu.emory.mathcs.nlp.common.util.IOUtils;

import edu.emory.mathcs.nlp.glove.corpus.Corpus;
import edu.emory.mathcs.nlp.glove.corpus.CorpusBuilder;
import edu.emory.mathcs.nlp.glove.corpus.SimpleCorpusBuilder;
import edu.emory.mathcs.nlp.glove.matrix.DenseMatrix;
import edu.emory.mathcs.nlp.glove.matrix.DenseVector;
import edu.emory.mathcs.nlp.glove.matrix.SparseMatrix;
import edu.emory.mathcs.nlp.glove.util.BinUtils;

/**
 * Global vectors for word representation.
 * <pre>
 * GloVe glove = new GloVe(new GloVeConfig().setVectorSize(50));
 * glove.fit(text).train();
 * glove.mostSimilar("physics", 3);
 * </pre>
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 * https://nlp.stanford.edu/pubs/glove.pdf
 */
public class GloVe
{
	private final GloVeConfig   config;
	private final CorpusBuilder corpus_builder;
	private final Random        rand;

	private Corpus       corpus;
	private SparseMatrix cooc_matrix;
	private long[]       entries;		// nonzero cells of the co-occurrence matrix
	private VectorSpace  space;
	private QueryEngine  query;
	private double[]     costs;

	public GloVe()
	{
		this(new GloVeConfig());
	}

	public GloVe(GloVeConfig config)
	{
		this(config, new SimpleCorpusBuilder(config.validate().getWindow(), config.getMinCount()));
	}

	/**
	 * @throws InvalidConfigurationException if the configuration is out of range.
	 */
	public GloVe(GloVeConfig config, CorpusBuilder builder)
	{
		this.config    = config.validate();
		corpus_builder = builder;
		rand           = new XORShiftRandom(config.getSeed());
		costs          = new double[0];
	}

//	=================================== Training ===================================

	/** Builds the corpus from the text and then calls {@link #fit(Corpus)}. */
	public GloVe fit(String text)
	{
		return fit(corpus_builder.build(text));
	}

	/**
	 * Builds the co-occurrence matrix of the corpus and initializes the word vectors.
	 * @throws GloVeException if the corpus has no words.
	 */
	public GloVe fit(Corpus corpus)
	{
		int vocab_size = corpus.getVocabulary().size();
		List<?> pairs = corpus.getPairs();
		if (vocab_size == 0) throw new GloVeException("The corpus has no words");

		BinUtils.LOG.info(String.format("- types = %d, tokens = %d, pairs = %d", vocab_size, corpus.getVocabulary().totalCount(), pairs.size()));
		BinUtils.LOG.info("Building co-occurrence matrix.");
		SparseMatrix matrix = new CooccurrenceBuilder(config.getThreadSize()).build(corpus.getPairs(), vocab_size);

		BinUtils.LOG.info("Initializing word vectors.");
		setModel(corpus, matrix, VectorSpace.initialize(vocab_size, config.getVectorSize(), rand));
		return this;
	}

	/**
	 * Runs {@link GloVeConfig#getEpochs()} epochs over the co-occurrence matrix.
	 * @throws IllegalStateException if neither {@link #fit(String)} nor {@link #load(File, File, File, File)} has been called.
	 */
	public GloVe train()
	{
		checkModel();
		BinUtils.LOG.info(String.format("Training word vectors: %d nonzero cells, %s", entries.length, config));
		costs = new Trainer(config, rand).train(space, cooc_matrix, entries);
		return this;
	}

	private void setModel(Corpus corpus, SparseMatrix matrix, VectorSpace space)
	{
		this.corpus = corpus;
		cooc_matrix = matrix;
		entries     = matrix.nonZeroEntries();
		this.space  = space;
		query       = new QueryEngine(corpus.getVocabulary(), space, corpus_builder::normalize);
		BinUtils.LOG.info(String.format("- co-occurrence nonzeros = %d", entries.length));
	}

	private void checkModel()
	{
		if (space == null) throw new IllegalStateException("Call fit() or load() first");
	}

//	=================================== Persistence ===================================

	/**
	 * Saves the corpus, the co-occurrence matrix ({@code V x V}), the word vectors ({@code V x D}),
	 * and the biases ({@code V}) to four files; the numeric payloads are raw big-endian doubles in row-major order.
	 */
	public void save(File corpusFile, File coocFile, File vectorFile, File biasFile) throws IOException
	{
		checkModel();
		BinUtils.LOG.info("Saving model: " + corpusFile + ", " + coocFile + ", " + vectorFile + ", " + biasFile);
		corpus.write(corpusFile);

		try (DataOutputStream out = createDataOutputStream(coocFile))
		{
			cooc_matrix.write(out);
		}

		try (DataOutputStream out = createDataOutputStream(vectorFile))
		{
			space.getWordVectors().write(out);
		}

		try (DataOutputStream out = createDataOutputStream(biasFile))
		{
			space.getBiases().write(out);
		}
	}

	/**
	 * Loads the files written by {@link #save(File, File, File, File)}.
	 * The vocabulary size is taken from the corpus, the vector size from the configuration.
	 * AdaGrad accumulators start afresh.
	 * @throws DataIntegrityException if the corpus cannot be read, a payload does not match the expected shape,
	 * or the co-occurrence matrix is not symmetric with positive counts.
	 */
	public GloVe load(File corpusFile, File coocFile, File vectorFile, File biasFile) throws IOException
	{
		BinUtils.LOG.info("Loading model: " + corpusFile + ", " + coocFile + ", " + vectorFile + ", " + biasFile);
		Corpus c;

		try
		{
			c = Corpus.read(corpusFile);
		}
		catch (IOException e)
		{
			if (!corpusFile.isFile()) throw e;
			throw new DataIntegrityException("Cannot read corpus: " + corpusFile, e);
		}

		int vocab_size  = c.getVocabulary().size();
		int vector_size = config.getVectorSize();
		if (vocab_size == 0) throw new DataIntegrityException("The corpus has no words: " + corpusFile);

		checkLength(coocFile  , SparseMatrix.byteSize(vocab_size)             , "co-occurrence matrix", vocab_size + "x" + vocab_size);
		checkLength(vectorFile, DenseMatrix.byteSize(vocab_size, vector_size), "word vectors"        , vocab_size + "x" + vector_size);
		checkLength(biasFile  , DenseVector.byteSize(vocab_size)             , "biases"              , Integer.toString(vocab_size));

		SparseMatrix matrix  = new SparseMatrix(vocab_size);
		DenseMatrix  vectors = VectorSpace.allocate(vocab_size, vector_size);
		DenseVector  biases  = new DenseVector(vocab_size);

		try (DataInputStream in = createDataInputStream(coocFile))
		{
			matrix.read(in);
		}

		if (!matrix.isPositive())  throw new DataIntegrityException("The co-occurrence matrix in " + coocFile + " has a negative or undefined count");
		if (!matrix.isSymmetric()) throw new DataIntegrityException("The co-occurrence matrix in " + coocFile + " is not symmetric");

		try (DataInputStream in = createDataInputStream(vectorFile))
		{
			vectors.read(in);
		}

		try (DataInputStream in = createDataInputStream(biasFile))
		{
			biases.read(in);
		}

		setModel(c, matrix, VectorSpace.of(vectors, biases));
		return this;
	}

	private void checkLength(File file, long expected, String name, String shape) throws IOException
	{
		if (!file.isFile()) throw new IOException("File not found: " + file);
		long length = file.length();

		if (length != expected)
			throw new DataIntegrityException(String.format("The %s in %s has %d bytes; %d expected for %s doubles", name, file, length, expected, shape));
	}

	static private DataOutputStream createDataOutputStream(File file) throws IOException
	{
		OutputStream out = IOUtils.createFileOutputStream(file.getPath());
		if (out == null) throw new FileNotFoundException("Cannot write " + file);
		return new DataOutputStream(new BufferedOutputStream(out));
	}

	static private DataInputStream createDataInputStream(File file) throws IOException
	{
		InputStream in = IOUtils.createFileInputStream(file.getPath());
		if (in == null) throw new FileNotFoundException("Cannot read " + file);
		return new DataInputStream(new BufferedInputStream(in));
	}

//	=================================== Queries ===================================

	public List<WordSimilarity> mostSimilar(String word)
	{
		return mostSimilar(word, QueryEngine.DEFAULT_NUM);
	}

	/** @see QueryEngine#mostSimilar(String, int) */
	public List<WordSimilarity> mostSimilar(String word, int num)
	{
		checkModel();
		return query.mostSimilar(word, num);
	}

	public List<WordSimilarity> analogyWords(String word1, String word2, String target)
	{
		return analogyWords(word1, word2, target, QueryEngine.DEFAULT_NUM, QueryEngine.DEFAULT_ACCURACY);
	}

	/** @see QueryEngine#analogyWords(String, String, String, int, double) */
	public List<WordSimilarity> analogyWords(String word1, String word2, String target, int num, double accuracy)
	{
		checkModel();
		return query.analogyWords(word1, word2, target, num, accuracy);
	}

	/** @throws UnsupportedOperationException always. */
	public void visualize()
	{
		throw new UnsupportedOperationException("Not implemented");
	}

//	=================================== Getters ===================================

	public GloVeConfig getConfig()
	{
		return config;
	}

	public Corpus getCorpus()
	{
		return corpus;
	}

	public SparseMatrix getCooccurrenceMatrix()
	{
		return cooc_matrix;
	}

	public VectorSpace getVectorSpace()
	{
		return space;
	}

	public QueryEngine getQueryEngine()
	{
		checkModel();
		return query;
	}

	/** @return the mean weighted cost of each epoch of the last {@link #train()}. */
	public double[] getCosts()
	{
		return costs.clone();
	}
}
