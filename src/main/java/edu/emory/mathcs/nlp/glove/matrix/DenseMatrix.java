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
 * Row-major matrix of doubles; row {@code i} starts at {@code i * getColumnSize()} of the backing array.
 * @author Austin Blodgett
 */
public class DenseMatrix
{
	private final int      row_size;
	private final int      column_size;
	private final double[] values;

	public DenseMatrix(int rowSize, int columnSize)
	{
		if (rowSize < 0 || columnSize < 0) throw new IllegalArgumentException("Negative shape: " + rowSize + "x" + columnSize);
		row_size    = rowSize;
		column_size = columnSize;
		values      = new double[Math.multiplyExact(rowSize, columnSize)];
	}

	private DenseMatrix(int rowSize, int columnSize, double[] values)
	{
		row_size    = rowSize;
		column_size = columnSize;
		this.values = values;
	}

	public int getRowSize()
	{
		return row_size;
	}

	public int getColumnSize()
	{
		return column_size;
	}

	public double get(int row, int column)
	{
		return values[index(row, column)];
	}

	public void set(int row, int column, double value)
	{
		values[index(row, column)] = value;
	}

	public void add(int row, int column, double value)
	{
		values[index(row, column)] += value;
	}

	/** @return a copy of the row. */
	public double[] getRow(int row)
	{
		int l = offset(row);
		return Arrays.copyOfRange(values, l, l + column_size);
	}

	/** @return the dot product between this row and the row of the other matrix. */
	public double dot(int row, DenseMatrix other, int otherRow)
	{
		if (column_size != other.column_size) throw new IllegalArgumentException("Dimension mismatch: " + column_size + " != " + other.column_size);
		return VectorUtils.dot(values, offset(row), other.values, other.offset(otherRow), column_size);
	}

	public double norm(int row)
	{
		return VectorUtils.norm(values, offset(row), column_size);
	}

	public void fill(double value)
	{
		Arrays.fill(values, value);
	}

	/** @return the offset of the row in the backing array. */
	public int offset(int row)
	{
		if (row < 0 || row >= row_size) throw new IndexOutOfBoundsException("Row " + row + " out of [0, " + row_size + ")");
		return row * column_size;
	}

	/** @return the backing array; changes are reflected in this matrix. */
	public double[] getArray()
	{
		return values;
	}

	public DenseMatrix copy()
	{
		return new DenseMatrix(row_size, column_size, values.clone());
	}

	/** Writes the cells in row-major order as big-endian doubles. */
	public void write(DataOutput out) throws IOException
	{
		for (double v : values) out.writeDouble(v);
	}

	/** Overwrites every cell with doubles read in row-major order. */
	public void read(DataInput in) throws IOException
	{
		for (int i=0; i<values.length; i++) values[i] = in.readDouble();
	}

	/** @return the number of bytes {@link #write(DataOutput)} produces for a matrix of the shape. */
	static public long byteSize(int rowSize, int columnSize)
	{
		return (long)rowSize * columnSize * Double.BYTES;
	}

	private int index(int row, int column)
	{
		if (column < 0 || column >= column_size) throw new IndexOutOfBoundsException("Column " + column + " out of [0, " + column_size + ")");
		return offset(row) + column;
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!(obj instanceof DenseMatrix)) return false;
		DenseMatrix m = (DenseMatrix)obj;
		return row_size == m.row_size && column_size == m.column_size && Arrays.equals(values, m.values);
	}

	@Override
	public int hashCode()
	{
		return 31 * (31 * row_size + column_size) + Arrays.hashCode(values);
	}
}
