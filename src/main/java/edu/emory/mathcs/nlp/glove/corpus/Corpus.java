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

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.emory.mathcs.nlp.common.util.IOUtils;

/**
 * The vocabulary of a text together with every token pair observed in it.
 * @author Austin Blodgett
 */
public class Corpus implements Serializable
{
	private static final long serialVersionUID = -1946087151377313418L;
	private final Vocabulary      vocab;
	private final List<TokenPair> pairs;

	public Corpus(Vocabulary vocab, List<TokenPair> pairs)
	{
		this.vocab = vocab;
		this.pairs = new ArrayList<>(pairs);
	}

	public Vocabulary getVocabulary()
	{
		return vocab;
	}

	public List<TokenPair> getPairs()
	{
		return Collections.unmodifiableList(pairs);
	}

	/** Writes this corpus as a serialized object. */
	public void write(File file) throws IOException
	{
		OutputStream out = IOUtils.createFileOutputStream(file.getPath());
		if (out == null) throw new FileNotFoundException("Cannot write " + file);

		try (ObjectOutputStream oout = new ObjectOutputStream(out))
		{
			oout.writeObject(this);
		}
	}

	/**
	 * Reads a corpus written by {@link #write(File)}.
	 * @throws IOException if the file cannot be read or does not hold a corpus.
	 */
	static public Corpus read(File file) throws IOException
	{
		InputStream in = file.isFile() ? IOUtils.createFileInputStream(file.getPath()) : null;
		if (in == null) throw new FileNotFoundException("Cannot read " + file);

		try (ObjectInputStream oin = new ObjectInputStream(in))
		{
			Object obj = oin.readObject();
			if (obj instanceof Corpus) return (Corpus)obj;
			throw new IOException(file + " does not contain a corpus: " + (obj == null ? null : obj.getClass().getName()));
		}
		catch (ClassNotFoundException e)
		{
			throw new IOException("Cannot deserialize " + file, e);
		}
	}
}
