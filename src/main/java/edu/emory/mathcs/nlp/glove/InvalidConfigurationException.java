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
 * Thrown when a configuration value is out of range; raised before anything is allocated.
 */
public class InvalidConfigurationException extends GloVeException
{
	private static final long serialVersionUID = 4172806533298540171L;
	private final String option;

	public InvalidConfigurationException(String option, Object value, String constraint)
	{
		super(String.format("Invalid %s: %s (%s)", option, value, constraint));
		this.option = option;
	}

	/** @return the name of the rejected option. */
	public String getOption()
	{
		return option;
	}
}
