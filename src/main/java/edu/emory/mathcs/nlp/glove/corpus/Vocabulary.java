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

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps each word form to a dense index in {@code [0, size())} and keeps its occurrence count.
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class Vocabulary implements Serializable
{
	private static final long serialVersionUID = 5406441768049538210L;
	static public final int OOV = -1;

	private Object2IntMap<String> index_map;
	private List<Word>            word_list;
	private long                  total_count;

	public Vocabulary()
	{
		index_map = new Object2IntOpenHashMap<>();
		index_map.defaultReturnValue(OOV);
		word_list = new ArrayList<>();
	}

	/**
	 * Adds the word to the vocabulary if absent, and increments its count by 1.
	 * @return the word object either already existing or newly introduced.
	 */
	public Word add(String word)
	{
		int index = index_map.getInt(word);
		Word w;

		if (index != OOV)
		{
			w = get(index);
			w.increment(1);
		}
		else
		{
			w = new Word(word, 1);
			index_map.put(word, size());
			word_list.add(w);
		}

		total_count++;
		return w;
	}

	public Word get(int index)
	{
		return word_list.get(index);
	}

	/** @return index of the word if exists; otherwise, {@link #OOV}. */
	public int indexOf(String word)
	{
		return index_map.getInt(word);
	}

	public boolean contains(String word)
	{
		return index_map.containsKey(word);
	}

	public int size()
	{
		return word_list.size();
	}

	/** @return total number of word tokens counted by this vocabulary. */
	public long totalCount()
	{
		return total_count;
	}

	public List<Word> list()
	{
		return Collections.unmodifiableList(word_list);
	}

	/**
	 * Sorts the words by count in descending order and re-assigns their indices.
	 * Words with the same count keep the order in which they were introduced.
	 * @param minCount words whose counts are less than the minimum count are discarded.
	 * @return total number of word counts after sorting.
	 */
	public long sort(int minCount)
	{
		ArrayList<Word> list = new ArrayList<>(size());
		long count = 0;

		for (Word w : word_list)
		{
			if (w.count >= minCount)
			{
				count += w.count;
				list.add(w);
			}
		}

		Collections.sort(list, Collections.reverseOrder());
		list.trimToSize();
		word_list = list;
		total_count = count;
		index_map.clear();

		for (int i=0; i<word_list.size(); i++)
			index_map.put(word_list.get(i).form, i);

		return count;
	}

	@Override
	public String toString()
	{
		return word_list.stream().map(Word::toString).collect(Collectors.joining(" "));
	}
}
