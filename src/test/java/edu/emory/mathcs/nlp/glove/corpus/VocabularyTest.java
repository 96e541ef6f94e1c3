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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * @author Austin Blodgett
 */
public class VocabularyTest
{
	@Test
	public void testVocabulary()
	{
		Vocabulary vocab = new Vocabulary();
		Word w0, w1, w2;

		w0 = vocab.add("A");
		w1 = vocab.add("B"); vocab.add("B");
		w2 = vocab.add("C");

		assertSame(w0, vocab.get(0));
		assertSame(w1, vocab.get(1));
		assertSame(w2, vocab.get(2));
		assertEquals(0, vocab.indexOf("A"));
		assertEquals(1, vocab.indexOf("B"));
		assertEquals(2, vocab.indexOf("C"));
		assertEquals(Vocabulary.OOV, vocab.indexOf("D"));
		assertEquals("A:1 B:2 C:1", vocab.toString());
		assertEquals(4, vocab.totalCount());

		vocab.sort(0);
		assertEquals("B:2 A:1 C:1", vocab.toString());
		assertEquals(0, vocab.indexOf("B"));
		assertEquals(1, vocab.indexOf("A"));
		assertEquals(2, vocab.indexOf("C"));

		vocab.add("C"); vocab.add("D");
		assertEquals(2, vocab.indexOf("C"));
		assertEquals(3, vocab.indexOf("D"));
		assertEquals("B:2 A:1 C:2 D:1", vocab.toString());

		assertEquals(4, vocab.sort(2));
		assertEquals("B:2 C:2", vocab.toString());
		assertEquals(Vocabulary.OOV, vocab.indexOf("A"));
		assertEquals(1, vocab.indexOf("C"));
		assertTrue (vocab.contains("B"));
		assertFalse(vocab.contains("D"));
		assertEquals(2, vocab.size());
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testListIsReadOnly()
	{
		Vocabulary vocab = new Vocabulary();
		vocab.add("A");
		vocab.list().clear();
	}
}
