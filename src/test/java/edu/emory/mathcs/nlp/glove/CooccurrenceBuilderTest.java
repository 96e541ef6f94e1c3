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
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import edu.emory.mathcs.nlp.glove.corpus.Corpus;
import edu.emory.mathcs.nlp.glove.corpus.SimpleCorpusBuilder;
import edu.emory.mathcs.nlp.glove.corpus.TokenPair;
import edu.emory.mathcs.nlp.glove.matrix.SparseMatrix;

/**
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class CooccurrenceBuilderTest
{
	@Test
	public void testHarmonicWeights()
	{
		Corpus corpus = new SimpleCorpusBuilder(2, 1).build("a b c");
		int a = corpus.getVocabulary().indexOf("a");
		int b = corpus.getVocabulary().indexOf("b");
		int c = corpus.getVocabulary().indexOf("c");

		for (int threads=1; threads<=4; threads++)
		{
			SparseMatrix m = new CooccurrenceBuilder(threads).build(corpus.getPairs(), 3);

			assertEquals(1  , m.get(a, b), 0);
			assertEquals(1  , m.get(b, a), 0);
			assertEquals(1  , m.get(b, c), 0);
			assertEquals(1  , m.get(c, b), 0);
			assertEquals(0.5, m.get(a, c), 0);
			assertEquals(0.5, m.get(c, a), 0);
			assertEquals(0  , m.get(a, a), 0);
			assertEquals(0  , m.get(b, b), 0);
			assertEquals(0  , m.get(c, c), 0);
			assertEquals(6  , m.nonZeroCount());
		}
	}

	@Test
	public void testAccumulation()
	{
		List<TokenPair> pairs = Arrays.asList(new TokenPair(0, 1, 1), new TokenPair(1, 0, 4), new TokenPair(2, 2, 2), new TokenPair(0, 1, 2));
		SparseMatrix m = new CooccurrenceBuilder(2).build(pairs, 3);

		assertEquals(1.75, m.get(0, 1), 1e-12);
		assertEquals(1.75, m.get(1, 0), 1e-12);
		assertEquals(1   , m.get(2, 2), 1e-12);
	}

	@Test
	public void testSymmetry()
	{
		Random rand = new Random(5);
		List<TokenPair> pairs = new ArrayList<>();
		int size = 50;

		for (int k=0; k<5000; k++)
			pairs.add(new TokenPair(rand.nextInt(size), rand.nextInt(size), 1 + rand.nextInt(5)));

		SparseMatrix single = new CooccurrenceBuilder(1).build(pairs, size);
		SparseMatrix multi  = new CooccurrenceBuilder(4).build(pairs, size);

		assertTrue(single.isSymmetric());
		assertTrue(multi.isSymmetric());
		assertEquals(single.nonZeroCount(), multi.nonZeroCount());

		for (int i=0; i<size; i++)
		{
			for (int j=0; j<size; j++)
			{
				assertEquals(multi.get(i, j), multi.get(j, i), 0);
				assertEquals(single.get(i, j), multi.get(i, j), 1e-9);
				assertTrue(multi.get(i, j) >= 0);
			}
		}
	}

	@Test
	public void testEmpty()
	{
		SparseMatrix m = new CooccurrenceBuilder(4).build(Collections.<TokenPair>emptyList(), 3);
		assertEquals(3, m.size());
		assertEquals(0, m.nonZeroCount());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testIndexOutOfRange()
	{
		List<TokenPair> pairs = new ArrayList<>();
		for (int k=0; k<100; k++) pairs.add(new TokenPair(0, 1, 1));
		pairs.add(new TokenPair(1, 3, 1));
		new CooccurrenceBuilder(4).build(pairs, 3);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidDistance()
	{
		new CooccurrenceBuilder(1).build(Collections.singletonList(new TokenPair(0, 1, 0)), 2);
	}

	@Test(expected = InvalidConfigurationException.class)
	public void testInvalidThreads()
	{
		new CooccurrenceBuilder(0);
	}
}
