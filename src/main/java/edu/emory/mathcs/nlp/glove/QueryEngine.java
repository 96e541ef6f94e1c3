/**
 * Copyright 2016, Emory University
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
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import edu.emory.mathcs.nlp.glove.corpus.Vocabulary;
import edu.emory.mathcs.nlp.glove.matrix.VectorUtils;

/**
 * Read-only similarity queries over trained word vectors.
 * Query words unknown to the vocabulary yield empty results.
 * @author Austin Blodgett
 */
public class QueryEngine
{
	static public final int    DEFAULT_NUM      = 3;
	static public final double DEFAULT_ACCURACY = 0.0001;

	private final Vocabulary             vocab;
	private final VectorSpace            space;
	private final UnaryOperator<String>  normalizer;

	/**
	 * @param normalizer maps a query word to the form stored in the vocabulary.
	 */
	public QueryEngine(Vocabulary vocab, VectorSpace space, UnaryOperator<String> normalizer)
	{
		if (vocab.size() != space.getVocabularySize())
			throw new DataIntegrityException("Vocabulary size mismatch: vocabulary " + vocab.size() + ", vectors " + space.getVocabularySize());

		this.vocab      = vocab;
		this.space      = space;
		this.normalizer = normalizer;
	}

	/**
	 * @return up to {@code num} words most similar to the word in descending order, excluding the word itself;
	 * an empty list if the word is unknown.
	 */
	public List<WordSimilarity> mostSimilar(String word, int num)
	{
		return limit(rank(normalizer.apply(word)), num);
	}

	/**
	 * Ranks every word other than the target by its similarity to the target,
	 * and drops words whose similarity is within {@code accuracy} of the similarity between {@code word1} and {@code word2}.
	 * @return up to {@code num} remaining words in descending order; an empty list if the target is unknown.
	 */
	public List<WordSimilarity> analogyWords(String word1, String word2, String target, int num, double accuracy)
	{
		double baseline = cosine(vector(normalizer.apply(word1)), vector(normalizer.apply(word2)));

		List<WordSimilarity> list = rank(normalizer.apply(target)).stream()
				.filter(s -> Math.abs(s.getSimilarity() - baseline) >= accuracy)
				.collect(Collectors.toList());

		return limit(list, num);
	}

	/** @return the cosine similarity between the two words; 0 if either is unknown. */
	public double similarity(String word1, String word2)
	{
		return cosine(vector(normalizer.apply(word1)), vector(normalizer.apply(word2)));
	}

	/** @return a copy of the vector of the (already normalized) word if exists; otherwise, {@code null}. */
	public double[] vector(String form)
	{
		int index = vocab.indexOf(form);
		return (index == Vocabulary.OOV) ? null : space.getVector(index);
	}

	/** @see VectorUtils#cosine(double[], double[]) */
	static public double cosine(double[] v1, double[] v2)
	{
		return VectorUtils.cosine(v1, v2);
	}

	/** @return every word but the given one, in descending order of similarity to it. */
	List<WordSimilarity> rank(String form)
	{
		double[] query = vector(form);
		if (query == null) return Collections.emptyList();

		List<WordSimilarity> list = new ArrayList<>(vocab.size());
		int index = vocab.indexOf(form);

		for (int i=0; i<vocab.size(); i++)
		{
			if (i == index) continue;
			list.add(new WordSimilarity(vocab.get(i).form, cosine(query, space.getVector(i))));
		}

		Collections.sort(list);
		return list;
	}

	private List<WordSimilarity> limit(List<WordSimilarity> list, int num)
	{
		return (list.size() <= num) ? list : new ArrayList<>(list.subList(0, Math.max(num, 0)));
	}
}
