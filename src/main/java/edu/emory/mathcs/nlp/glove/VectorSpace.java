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

import java.util.Random;

import edu.emory.mathcs.nlp.glove.matrix.DenseMatrix;
import edu.emory.mathcs.nlp.glove.matrix.DenseVector;

/**
 * Word vectors, biases, and their AdaGrad accumulators.
 * Every table has one row (or cell) per word index.
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class VectorSpace
{
	/** Initial sum of squared gradients; never 0 so the first update does not divide by 0. */
	static public final double INITIAL_GRADIENT_SQUARE = 1.0;

	private final DenseMatrix W;		// word vectors
	private final DenseVector B;		// word biases
	private final DenseMatrix gradsq_W;
	private final DenseVector gradsq_B;

	VectorSpace(DenseMatrix W, DenseVector B, DenseMatrix gradsqW, DenseVector gradsqB)
	{
		if (W.getRowSize() != B.size() || W.getRowSize() != gradsqW.getRowSize() || W.getRowSize() != gradsqB.size() || W.getColumnSize() != gradsqW.getColumnSize())
			throw new DataIntegrityException(String.format("Inconsistent shapes: vectors %dx%d, biases %d, accumulators %dx%d and %d",
					W.getRowSize(), W.getColumnSize(), B.size(), gradsqW.getRowSize(), gradsqW.getColumnSize(), gradsqB.size()));

		this.W   = W;
		this.B   = B;
		gradsq_W = gradsqW;
		gradsq_B = gradsqB;
	}

	/**
	 * Creates word vectors whose components are drawn uniformly from {@code [-0.5/vectorSize, 0.5/vectorSize)},
	 * zero biases, and accumulators set to {@link #INITIAL_GRADIENT_SQUARE}.
	 * @throws InvalidConfigurationException if either size is not positive.
	 */
	static public VectorSpace initialize(int vocabSize, int vectorSize, Random rand)
	{
		DenseMatrix W = allocate(vocabSize, vectorSize);
		double[] w = W.getArray();

		for (int i=0; i<w.length; i++)
			w[i] = (rand.nextDouble() - 0.5) / vectorSize;

		return new VectorSpace(W, new DenseVector(vocabSize), freshGradients(vocabSize, vectorSize), freshBiasGradients(vocabSize));
	}

	/**
	 * Wraps existing vectors and biases, e.g., read from disk, with fresh accumulators.
	 * @throws DataIntegrityException if the number of vectors and biases differ.
	 */
	static public VectorSpace of(DenseMatrix W, DenseVector B)
	{
		return new VectorSpace(W, B, freshGradients(W.getRowSize(), W.getColumnSize()), freshBiasGradients(B.size()));
	}

	/**
	 * Allocates a zero matrix of the shape.
	 * @throws InvalidConfigurationException if either size is not positive.
	 */
	static DenseMatrix allocate(int vocabSize, int vectorSize)
	{
		if (vocabSize  <= 0) throw new InvalidConfigurationException("vocabulary size", vocabSize, "must be greater than 0");
		if (vectorSize <= 0) throw new InvalidConfigurationException("size", vectorSize, "must be greater than 0");
		return new DenseMatrix(vocabSize, vectorSize);
	}

	static private DenseMatrix freshGradients(int vocabSize, int vectorSize)
	{
		DenseMatrix m = new DenseMatrix(vocabSize, vectorSize);
		m.fill(INITIAL_GRADIENT_SQUARE);
		return m;
	}

	static private DenseVector freshBiasGradients(int vocabSize)
	{
		DenseVector v = new DenseVector(vocabSize);
		v.fill(INITIAL_GRADIENT_SQUARE);
		return v;
	}

	public int getVocabularySize()
	{
		return W.getRowSize();
	}

	public int getVectorSize()
	{
		return W.getColumnSize();
	}

	public DenseMatrix getWordVectors()
	{
		return W;
	}

	public DenseVector getBiases()
	{
		return B;
	}

	public DenseMatrix getWordGradientSquares()
	{
		return gradsq_W;
	}

	public DenseVector getBiasGradientSquares()
	{
		return gradsq_B;
	}

	/** @return a copy of the vector of the word. */
	public double[] getVector(int index)
	{
		return W.getRow(index);
	}

	public double getBias(int index)
	{
		return B.get(index);
	}

	/**
	 * Overwrites all four tables with the values of the other space.
	 * @throws DataIntegrityException if the shapes differ.
	 */
	public void copyFrom(VectorSpace other)
	{
		if (getVocabularySize() != other.getVocabularySize() || getVectorSize() != other.getVectorSize())
			throw new DataIntegrityException(String.format("Shape mismatch: %dx%d != %dx%d", getVocabularySize(), getVectorSize(), other.getVocabularySize(), other.getVectorSize()));

		System.arraycopy(other.W.getArray(), 0, W.getArray(), 0, W.getArray().length);
		System.arraycopy(other.B.getArray(), 0, B.getArray(), 0, B.getArray().length);
		System.arraycopy(other.gradsq_W.getArray(), 0, gradsq_W.getArray(), 0, gradsq_W.getArray().length);
		System.arraycopy(other.gradsq_B.getArray(), 0, gradsq_B.getArray(), 0, gradsq_B.getArray().length);
	}

	/** @return a deep copy of all four tables. */
	public VectorSpace copy()
	{
		return new VectorSpace(W.copy(), B.copy(), gradsq_W.copy(), gradsq_B.copy());
	}
}
