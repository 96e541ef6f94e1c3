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

/**
 * How training workers update word vectors and biases that are shared across threads.
 */
public enum UpdateMode
{
	/**
	 * Lock-free updates: two workers may read-modify-write the same row concurrently and one update can be lost.
	 * Results are nondeterministic when more than one thread is used.
	 */
	HOGWILD,
	/**
	 * Each epoch is split into rounds in which no two cells share a row, and the rounds run one after another.
	 * Every row receives its updates in the shuffled order, so the result is the same for any number of threads.
	 */
	DETERMINISTIC
}
