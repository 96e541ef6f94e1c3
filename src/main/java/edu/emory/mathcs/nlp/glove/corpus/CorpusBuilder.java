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

/**
 * Turns raw text into a vocabulary and token pairs.
 * @author Austin Blodgett
 */
public interface CorpusBuilder
{
	Corpus build(String text);

	/**
	 * Maps a query word to the form stored in the vocabulary,
	 * applying the same normalization (e.g., lowercasing, stemming) as {@link #build(String)}.
	 */
	String normalize(String word);
}
