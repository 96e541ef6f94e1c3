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
package edu.emory.mathcs.nlp.glove.bin;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.kohsuke.args4j.Option;

import edu.emory.mathcs.nlp.glove.GloVe;
import edu.emory.mathcs.nlp.glove.GloVeConfig;
import edu.emory.mathcs.nlp.glove.util.BinUtils;

/**
 * Fits a model to a text file, trains it, and saves it as {@code <output>.corpus}, {@code .cooc}, {@code .vec}, and {@code .bias}.
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class GloVeTrain
{
	static public final String EXT_CORPUS = ".corpus";
	static public final String EXT_COOC   = ".cooc";
	static public final String EXT_VECTOR = ".vec";
	static public final String EXT_BIAS   = ".bias";

	@Option(name="-train", usage="path to the training file (UTF-8 text, one sentence per line).", required=true, metaVar="<filepath>")
	String train_file = null;
	@Option(name="-output", usage="prefix of the output files.", required=true, metaVar="<filename>")
	String output_prefix = null;

	GloVeConfig config = new GloVeConfig();

	public GloVeTrain(String[] args)
	{
		BinUtils.initArgs(args, this, config);
	}

	GloVeTrain(GloVeConfig config, String trainFile, String outputPrefix)
	{
		this.config   = config;
		train_file    = trainFile;
		output_prefix = outputPrefix;
	}

	public GloVe run() throws IOException
	{
		BinUtils.LOG.info("Reading " + train_file);
		String text = new String(Files.readAllBytes(Paths.get(train_file)), StandardCharsets.UTF_8);

		GloVe glove = new GloVe(config);
		glove.fit(text).train();
		glove.save(file(output_prefix, EXT_CORPUS), file(output_prefix, EXT_COOC), file(output_prefix, EXT_VECTOR), file(output_prefix, EXT_BIAS));
		return glove;
	}

	static File file(String prefix, String extension)
	{
		return new File(prefix + extension);
	}

	static public void main(String[] args)
	{
		try
		{
			new GloVeTrain(args).run();
		}
		catch (Exception e)
		{
			BinUtils.LOG.error("Training failed", e);
			System.exit(1);
		}
	}
}
