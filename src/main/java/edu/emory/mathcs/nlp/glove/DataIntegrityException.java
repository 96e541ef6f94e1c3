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
 * Thrown when persisted artifacts disagree with each other, e.g., a matrix whose shape does not match the vocabulary size.
 */
public class DataIntegrityException extends GloVeException
{
	private static final long serialVersionUID = -6651043338727415823L;

	public DataIntegrityException(String message)
	{
		super(message);
	}

	public DataIntegrityException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
