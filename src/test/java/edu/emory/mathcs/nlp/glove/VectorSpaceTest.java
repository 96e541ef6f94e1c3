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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Random;

import org.junit.Test;

import edu.emory.mathcs.nlp.common.random.XORShiftRandom;

import edu.emory.mathcs.nlp.glove.matrix.DenseMatrix;
import edu.emory.mathcs.nlp.glove.matrix.DenseVector;

/**
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class VectorSpaceTest
{
	@Test
	public void testInitialize()
	{
		VectorSpace space = VectorSpace.initialize(10, 4, new XORShiftRandom(1));
		double bound = 0.5 / 4;

		assertEquals(10, space.getVocabularySize());
		assertEquals(4 , space.getVectorSize());

		for (double w : space.getWordVectors().getArray())
			assertTrue(-bound <= w && w < bound);

		for (double b : space.getBiases().getArray())
			assertEquals(0, b, 0);

		for (double g : space.getWordGradientSquares().getArray())
			assertEquals(VectorSpace.INITIAL_GRADIENT_SQUARE, g, 0);

		for (double g : space.getBiasGradientSquares().getArray())
			assertEquals(VectorSpace.INITIAL_GRADIENT_SQUARE, g, 0);
	}

	@Test
	public void testSeed()
	{
		assertEquals(VectorSpace.initialize(5, 3, new XORShiftRandom(7)).getWordVectors(), VectorSpace.initialize(5, 3, new XORShiftRandom(7)).getWordVectors());
		assertNotEquals(VectorSpace.initialize(5, 3, new XORShiftRandom(7)).getWordVectors(), VectorSpace.initialize(5, 3, new XORShiftRandom(8)).getWordVectors());
	}

	@Test
	public void testCopy()
	{
		VectorSpace space = VectorSpace.initialize(3, 2, new XORShiftRandom(1));
		VectorSpace copy  = space.copy();

		copy.getWordVectors().set(0, 0, 9);
		copy.getBiases().set(1, 9);
		assertNotEquals(9, space.getWordVectors().get(0, 0), 0);
		assertEquals(0, space.getBias(1), 0);

		space.copyFrom(copy);
		assertEquals(9, space.getVector(0)[0], 0);
		assertEquals(9, space.getBias(1), 0);
	}

	@Test(expected = InvalidConfigurationException.class)
	public void testZeroVectorSize()
	{
		VectorSpace.initialize(3, 0, new XORShiftRandom(1));
	}

	@Test(expected = InvalidConfigurationException.class)
	public void testZeroVocabulary()
	{
		VectorSpace.initialize(0, 3, new XORShiftRandom(1));
	}

	@Test(expected = DataIntegrityException.class)
	public void testShapeMismatch()
	{
		VectorSpace.of(new DenseMatrix(3, 2), new DenseVector(4));
	}
}
