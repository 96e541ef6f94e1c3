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
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class Word implements Serializable, Comparable<Word>
{
	private static final long serialVersionUID = -2216341807536618460L;
	public String form;
	public long   count;

	public Word(String form, long count)
	{
		this.form  = form;
		this.count = count;
	}

	public void increment(long count)
	{
		this.count += count;
	}

	@Override
	public int compareTo(Word o)
	{
		return Long.compare(count, o.count);
	}

	@Override
	public String toString()
	{
		return form + ":" + count;
	}
}
