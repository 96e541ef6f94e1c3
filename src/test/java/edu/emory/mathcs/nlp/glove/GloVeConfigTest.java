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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.kohsuke.args4j.CmdLineException;

import edu.emory.mathcs.nlp.glove.util.BinUtils;

/**
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class GloVeConfigTest
{
	@Test
	public void testDefaults()
	{
		GloVeConfig config = new GloVeConfig().validate();

		assertEquals(100 , config.getMaxCount(), 0);
		assertEquals(0.05, config.getLearningRate(), 0);
		assertEquals(0.75, config.getAlpha(), 0);
		assertEquals(30  , config.getVectorSize());
		assertEquals(5   , config.getEpochs());
		assertEquals(4   , config.getThreadSize());
		assertEquals(2   , config.getWindow());
		assertEquals(5   , config.getMinCount());
		assertEquals(1   , config.getSeed());
		assertEquals(UpdateMode.HOGWILD, config.getUpdateMode());
	}

	@Test
	public void testParseArgs() throws CmdLineException
	{
		GloVeConfig config = new GloVeConfig();
		String[] args = {"-size", "50", "-iter", "15", "-threads", "8", "-window", "3", "-min-count", "2", "-alpha", "0.5",
				"-max-count", "10", "-learning-rate", "0.1", "-update-mode", "DETERMINISTIC", "-seed", "7"};

		BinUtils.parseArgs(args, config);
		config.validate();

		assertEquals(50 , config.getVectorSize());
		assertEquals(15 , config.getEpochs());
		assertEquals(8  , config.getThreadSize());
		assertEquals(3  , config.getWindow());
		assertEquals(2  , config.getMinCount());
		assertEquals(0.5, config.getAlpha(), 0);
		assertEquals(10 , config.getMaxCount(), 0);
		assertEquals(0.1, config.getLearningRate(), 0);
		assertEquals(7  , config.getSeed());
		assertEquals(UpdateMode.DETERMINISTIC, config.getUpdateMode());
	}

	@Test(expected = CmdLineException.class)
	public void testUnknownOption() throws CmdLineException
	{
		BinUtils.parseArgs(new String[]{"-vector-size", "5"}, new GloVeConfig());
	}

	@Test
	public void testValidate()
	{
		assertInvalid(new GloVeConfig().setThreadSize(0), "threads");
		assertInvalid(new GloVeConfig().setVectorSize(0), "size");
		assertInvalid(new GloVeConfig().setMaxCount(0), "max-count");
		assertInvalid(new GloVeConfig().setLearningRate(-1), "learning-rate");
		assertInvalid(new GloVeConfig().setAlpha(0), "alpha");
		assertInvalid(new GloVeConfig().setAlpha(1.5), "alpha");
		assertInvalid(new GloVeConfig().setEpochs(-1), "iter");
		assertInvalid(new GloVeConfig().setWindow(0), "window");
		assertInvalid(new GloVeConfig().setMinCount(-1), "min-count");
		assertInvalid(new GloVeConfig().setUpdateMode(null), "update-mode");
		assertInvalid(new GloVeConfig().setSeed(0), "seed");

		new GloVeConfig().setAlpha(1).setEpochs(0).setMinCount(0).validate();
	}

	private void assertInvalid(GloVeConfig config, String option)
	{
		try
		{
			config.validate();
			fail(option);
		}
		catch (InvalidConfigurationException e)
		{
			assertEquals(option, e.getOption());
		}
	}
}
