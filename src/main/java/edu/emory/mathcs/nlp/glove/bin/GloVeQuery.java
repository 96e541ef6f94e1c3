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
package edu.emory.mathcs.nlp.glove.bin;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;

import org.kohsuke.args4j.Option;

import edu.emory.mathcs.nlp.glove.GloVe;
import edu.emory.mathcs.nlp.glove.GloVeConfig;
import edu.emory.mathcs.nlp.glove.QueryEngine;
import edu.emory.mathcs.nlp.glove.WordSimilarity;
import edu.emory.mathcs.nlp.glove.util.BinUtils;

/**
 * Loads a model saved by {@link GloVeTrain} and answers queries read from the standard input:
 * one word for the most similar words, three words {@code word1 word2 target} for analogy words.
 * @author Austin Blodgett
 */
public class GloVeQuery
{
	static private final Pattern SPACES = Pattern.compile("\\s+");

	@Option(name="-input", usage="prefix of the model files written by GloVeTrain.", required=true, metaVar="<filename>")
	String input_prefix = null;
	@Option(name="-n", usage="number of words to return (default: 3).", required=false, metaVar="<integer>")
	int num = QueryEngine.DEFAULT_NUM;
	@Option(name="-accuracy", usage="analogy candidates this close to the baseline similarity are dropped (default: 0.0001).", required=false, metaVar="<double>")
	double accuracy = QueryEngine.DEFAULT_ACCURACY;

	GloVeConfig config = new GloVeConfig();
	GloVe glove;

	public GloVeQuery(String[] args) throws IOException
	{
		BinUtils.initArgs(args, this, config);
		load();
	}

	GloVeQuery(GloVeConfig config, String inputPrefix) throws IOException
	{
		this.config  = config;
		input_prefix = inputPrefix;
		load();
	}

	private void load() throws IOException
	{
		glove = new GloVe(config).load(
				GloVeTrain.file(input_prefix, GloVeTrain.EXT_CORPUS),
				GloVeTrain.file(input_prefix, GloVeTrain.EXT_COOC),
				GloVeTrain.file(input_prefix, GloVeTrain.EXT_VECTOR),
				GloVeTrain.file(input_prefix, GloVeTrain.EXT_BIAS));
	}

	/**
	 * Answers one query line.
	 * @return {@code false} if the line cannot be parsed.
	 */
	public boolean process(String line, PrintStream out)
	{
		String[] words = SPACES.split(line.trim());
		List<WordSimilarity> list;

		if (words.length == 1 && !words[0].isEmpty())
			list = glove.mostSimilar(words[0], num);
		else if (words.length == 3)
			list = glove.analogyWords(words[0], words[1], words[2], num, accuracy);
		else
			return false;

		if (list.isEmpty())
			out.println("Cannot find word vector.");

		for (WordSimilarity s : list)
			out.println(s.getWord() + "\t" + String.format("%1$.6f", s.getSimilarity()));

		return true;
	}

	public static void main(String[] args)
	{
		try
		{
			GloVeQuery query = new GloVeQuery(args);
			BufferedReader br = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
			String input;

			System.out.println("Please input a word, or three words (e.g., quantum physics atom), or type q to quit.");

			while ((input = br.readLine()) != null)
			{
				if (input.equals("q")) break;
				if (!query.process(input, System.out))
					System.err.println("Cannot parse the query; type one or three words.");
			}
		}
		catch (IOException e)
		{
			BinUtils.LOG.error("Query failed", e);
			System.exit(1);
		}
	}
}
