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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.emory.mathcs.nlp.glove.GloVe;
import edu.emory.mathcs.nlp.glove.GloVeConfig;

/**
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class GloVeTrainTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testTrainAndQuery() throws Exception
	{
		File train = folder.newFile("train.txt");
		StringBuilder build = new StringBuilder();

		for (int i=0; i<10; i++)
			build.append("quantum physics studies the atom\nclassical physics studies the planet\n");

		Files.write(train.toPath(), build.toString().getBytes(StandardCharsets.UTF_8));
		String prefix = new File(folder.getRoot(), "model").getPath();
		GloVeConfig config = new GloVeConfig().setVectorSize(8).setEpochs(3).setThreadSize(2).setMinCount(1);

		GloVe glove = new GloVeTrain(config, train.getPath(), prefix).run();
		assertEquals(7, glove.getCorpus().getVocabulary().size());

		for (String ext : new String[]{GloVeTrain.EXT_CORPUS, GloVeTrain.EXT_COOC, GloVeTrain.EXT_VECTOR, GloVeTrain.EXT_BIAS})
			assertTrue(GloVeTrain.file(prefix, ext).isFile());

		GloVeQuery query = new GloVeQuery(config, prefix);
		ByteArrayOutputStream bout = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bout, true, "UTF-8");

		assertTrue(query.process("physics", out));
		String[] lines = bout.toString("UTF-8").trim().split("\\r?\\n");
		assertEquals(3, lines.length);
		for (String line : lines) assertTrue(line.matches("\\p{L}+\t-?\\d[.,]\\d{6}"));

		bout.reset();
		assertTrue(query.process("  unicorn ", out));
		assertEquals("Cannot find word vector.", bout.toString("UTF-8").trim());

		bout.reset();
		assertTrue(query.process("quantum atom classical", out));
		assertFalse(bout.toString("UTF-8").isEmpty());

		assertFalse(query.process("quantum physics", out));
		assertFalse(query.process("", out));
	}
}
