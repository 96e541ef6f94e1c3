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

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;

/**
 * @author Austin Blodgett
 */
public class DenseVector
{
	private final double[] values;

	public DenseVector(int size)
	{
		if (size < 0) throw new IllegalArgumentException("Negative size: " + size);
		values = new double[size];
	}

	public DenseVector(double[] values)
	{
		this.values = values;
	}

	public int size()
	{
		return values.length;
	}

	public double get(int index)
	{
		return values[index];
	}

	public void set(int index, double value)
	{
		values[index] = value;
	}

	public void add(int index, double value)
	{
		values[index] += value;
	}

	public void fill(double value)
	{
		Arrays.fill(values, value);
	}

	/** @return the backing array; changes are reflected in this vector. */
	public double[] getArray()
	{
		return values;
	}

	public DenseVector copy()
	{
		return new DenseVector(values.clone());
	}

	/** Writes the values as big-endian doubles. */
	public void write(DataOutput out) throws IOException
	{
		for (double v : values) out.writeDouble(v);
	}

	/** Overwrites every value with {@link #size()} doubles read from the input. */
	public void read(DataInput in) throws IOException
	{
		for (int i=0; i<values.length; i++) values[i] = in.readDouble();
	}

	/** @return the number of bytes {@link #write(DataOutput)} produces for a vector of the size. */
	static public long byteSize(int size)
	{
		return (long)size * Double.BYTES;
	}

	@Override
	public boolean equals(Object obj)
	{
		return obj instanceof DenseVector && Arrays.equals(values, ((DenseVector)obj).values);
	}

	@Override
	public int hashCode()
	{
		return Arrays.hashCode(values);
	}
}
