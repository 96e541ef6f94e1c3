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

/**
 * A word and its cosine similarity to a query.
 * @author Austin Blodgett
 */
public class WordSimilarity implements Comparable<WordSimilarity>
{
	private final String word;
	private final double similarity;

	public WordSimilarity(String word, double similarity)
	{
		this.word       = word;
		this.similarity = similarity;
	}

	public String getWord()
	{
		return word;
	}

	public double getSimilarity()
	{
		return similarity;
	}

	/** Orders by similarity in descending order. */
	@Override
	public int compareTo(WordSimilarity o)
	{
		return Double.compare(o.similarity, similarity);
	}

	@Override
	public String toString()
	{
		return word + " " + similarity;
	}
}
