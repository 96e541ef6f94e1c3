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
package edu.emory.mathcs.nlp.glove.corpus;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Treats each line as a sentence, splits it on anything but letters and digits, and lowercases every token.
 * Pairs never cross a line boundary.
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu}), Austin Blodgett
 */
public class SimpleCorpusBuilder implements CorpusBuilder
{
	static private final Pattern NEW_LINE  = Pattern.compile("\\r?\\n");
	static private final Pattern DELIMITER = Pattern.compile("[^\\p{L}\\p{N}]+");

	private final int window;
	private final int min_count;

	/**
	 * @param window   words at most this many positions apart form a pair.
	 * @param minCount words that appear less than this many times are discarded.
	 */
	public SimpleCorpusBuilder(int window, int minCount)
	{
		if (window <= 0) throw new IllegalArgumentException("window must be greater than 0: " + window);
		this.window = window;
		this.min_count = minCount;
	}

	@Override
	public Corpus build(String text)
	{
		List<List<String>> sentences = NEW_LINE.splitAsStream(text).map(this::tokenize).filter(s -> !s.isEmpty()).collect(Collectors.toList());
		Vocabulary vocab = new Vocabulary();

		for (List<String> sentence : sentences)
			for (String word : sentence) vocab.add(word);

		vocab.sort(min_count);
		List<TokenPair> pairs = new ArrayList<>();

		for (List<String> sentence : sentences)
			addPairs(pairs, toIndices(vocab, sentence));

		return new Corpus(vocab, pairs);
	}

	/** Drops every character but letters and digits, and lowercases the rest. */
	@Override
	public String normalize(String word)
	{
		return DELIMITER.matcher(word).replaceAll("").toLowerCase(Locale.ROOT);
	}

	List<String> tokenize(String line)
	{
		return Arrays.stream(DELIMITER.split(line)).filter(s -> !s.isEmpty()).map(this::normalize).collect(Collectors.toList());
	}

	/** Discarded words are dropped before distances are measured. */
	private int[] toIndices(Vocabulary vocab, List<String> sentence)
	{
		IntArrayList indices = new IntArrayList(sentence.size());
		int index;

		for (String word : sentence)
		{
			index = vocab.indexOf(word);
			if (index != Vocabulary.OOV) indices.add(index);
		}

		return indices.toIntArray();
	}

	private void addPairs(List<TokenPair> pairs, int[] words)
	{
		int i, j;

		for (i=0; i<words.length; i++)
			for (j=i+1; j<words.length && j-i<=window; j++)
				pairs.add(new TokenPair(words[i], words[j], j-i));
	}
}
