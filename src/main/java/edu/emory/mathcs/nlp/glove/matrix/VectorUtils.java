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
package edu.emory.mathcs.nlp.glove.matrix;

/**
 * @author Austin Blodgett
 */
public class VectorUtils
{
	private VectorUtils() {}

	static public double dot(double[] x, int xOffset, double[] y, int yOffset, int length)
	{
		double sum = 0;

		for (int k=0; k<length; k++)
			sum += x[xOffset+k] * y[yOffset+k];

		return sum;
	}

	static public double dot(double[] x, double[] y)
	{
		if (x.length != y.length) throw new IllegalArgumentException("Dimension mismatch: " + x.length + " != " + y.length);
		return dot(x, 0, y, 0, x.length);
	}

	static public double norm(double[] x, int offset, int length)
	{
		return Math.sqrt(dot(x, offset, x, offset, length));
	}

	static public double norm(double[] x)
	{
		return norm(x, 0, x.length);
	}

	/**
	 * @return the cosine similarity between the two vectors;
	 * 0 if either vector is {@code null} or has no magnitude.
	 */
	static public double cosine(double[] x, double[] y)
	{
		if (x == null || y == null) return 0;
		double z = norm(x) * norm(y);
		return (z == 0) ? 0 : dot(x, y) / z;
	}
}
