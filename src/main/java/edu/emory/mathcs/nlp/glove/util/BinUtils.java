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
package edu.emory.mathcs.nlp.glove.util;

import org.kohsuke.args4j.ClassParser;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class BinUtils
{
	static public final Logger LOG = LoggerFactory.getLogger(BinUtils.class);

	/**
	 * Populates the {@link org.kohsuke.args4j.Option} fields of the beans from the command line arguments.
	 * Prints the usage and exits if the arguments cannot be parsed.
	 */
	static public void initArgs(String[] args, Object bean, Object... others)
	{
		CmdLineParser parser = createParser(bean, others);

		try
		{
			parser.parseArgument(args);
		}
		catch (CmdLineException e)
		{
			System.err.println(e.getMessage());
			parser.printUsage(System.err);
			System.exit(1);
		}
	}

	/** Same as {@link #initArgs(String[], Object, Object...)} but throws instead of exiting. */
	static public void parseArgs(String[] args, Object bean, Object... others) throws CmdLineException
	{
		createParser(bean, others).parseArgument(args);
	}

	static private CmdLineParser createParser(Object bean, Object... others)
	{
		CmdLineParser parser = new CmdLineParser(bean);
		ClassParser classParser = new ClassParser();
		for (Object other : others) classParser.parse(other, parser);
		return parser;
	}
}
