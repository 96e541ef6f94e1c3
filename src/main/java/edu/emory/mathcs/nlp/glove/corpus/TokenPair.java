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

import java.io.Serializable;

/**
 * One observation of two words occurring {@code distance} positions apart.
 */
public class TokenPair implements Serializable
{
	private static final long serialVersionUID = 3560986125127330496L;
	private final int first;
	private final int second;
	private final int distance;

	public TokenPair(int first, int second, int distance)
	{
		this.first    = first;
		this.second   = second;
		this.distance = distance;
	}

	public int getFirst()
	{
		return first;
	}

	public int getSecond()
	{
		return second;
	}

	/** @return the number of positions between the two words; at least 1 for a valid pair. */
	public int getDistance()
	{
		return distance;
	}

	@Override
	public String toString()
	{
		return "(" + first + ", " + second + ", " + distance + ")";
	}
}
