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

import it.unimi.dsi.fastutil.doubles.DoubleIterator;
import it.unimi.dsi.fastutil.ints.Int2DoubleMap;
import it.unimi.dsi.fastutil.ints.Int2DoubleMaps;
import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.Arrays;

/**
 * Square matrix that stores only its nonzero cells, one hash map per row.
 * @author Jinho D. Choi ({@code jinho.choi@emory.edu})
 */
public class SparseMatrix
{
	private final Int2DoubleOpenHashMap[] rows;

	public SparseMatrix(int size)
	{
		if (size < 0) throw new IllegalArgumentException("Negative size: " + size);
		rows = new Int2DoubleOpenHashMap[size];
		for (int i=0; i<size; i++) rows[i] = new Int2DoubleOpenHashMap();
	}

	/** @return the number of rows, which is also the number of columns. */
	public int size()
	{
		return rows.length;
	}

	public double get(int row, int column)
	{
		checkRange(row, column);
		return rows[row].get(column);
	}

	/**
	 * Adds the value to the cell; a cell that becomes 0 is removed.
	 * @throws IllegalArgumentException if either index is out of {@code [0, size())}.
	 */
	public void add(int row, int column, double value)
	{
		checkRange(row, column);
		if (value == 0) return;
		Int2DoubleOpenHashMap r = rows[row];
		if (r.addTo(column, value) + value == 0) r.remove(column);
	}

	/** Sets the cell to the value; setting 0 removes the cell. */
	public void set(int row, int column, double value)
	{
		checkRange(row, column);
		if (value == 0) rows[row].remove(column);
		else rows[row].put(column, value);
	}

	/** Adds every nonzero cell of the other matrix to this matrix. */
	public void addAll(SparseMatrix other)
	{
		if (other.size() != size()) throw new IllegalArgumentException("Size mismatch: " + size() + " != " + other.size());

		for (int i=0; i<rows.length; i++)
			for (Int2DoubleMap.Entry e : Int2DoubleMaps.fastIterable(other.rows[i]))
				add(i, e.getIntKey(), e.getDoubleValue());
	}

	/** @return a read-only view of the nonzero cells in the row, keyed by column. */
	public Int2DoubleMap getRow(int row)
	{
		return Int2DoubleMaps.unmodifiable(rows[row]);
	}

	public long nonZeroCount()
	{
		long count = 0;
		for (Int2DoubleOpenHashMap r : rows) count += r.size();
		return count;
	}

	/**
	 * @return the coordinates of every nonzero cell packed by {@link #pack(int, int)},
	 * ordered by row and then by column.
	 */
	public long[] nonZeroEntries()
	{
		LongArrayList entries = new LongArrayList();
		int[] columns;

		for (int i=0; i<rows.length; i++)
		{
			columns = rows[i].keySet().toIntArray();
			Arrays.sort(columns);
			for (int j : columns) entries.add(pack(i, j));
		}

		return entries.toLongArray();
	}

	public boolean isSymmetric()
	{
		for (int i=0; i<rows.length; i++)
			for (Int2DoubleMap.Entry e : Int2DoubleMaps.fastIterable(rows[i]))
				if (rows[e.getIntKey()].get(i) != e.getDoubleValue()) return false;

		return true;
	}

	/** @return {@code true} if every nonzero cell is greater than 0. */
	public boolean isPositive()
	{
		for (Int2DoubleOpenHashMap r : rows)
			for (DoubleIterator it = r.values().iterator(); it.hasNext();)
				if (!(it.nextDouble() > 0)) return false;

		return true;
	}

	/** Writes all {@code size() x size()} cells, zeros included, in row-major order as big-endian doubles. */
	public void write(DataOutput out) throws IOException
	{
		for (Int2DoubleOpenHashMap r : rows)
			for (int j=0; j<rows.length; j++)
				out.writeDouble(r.get(j));
	}

	/** Reads {@code size() x size()} cells written by {@link #write(DataOutput)}, replacing the current content. */
	public void read(DataInput in) throws IOException
	{
		for (int i=0; i<rows.length; i++)
		{
			rows[i].clear();
			for (int j=0; j<rows.length; j++) set(i, j, in.readDouble());
		}
	}

	/** @return the number of bytes {@link #write(DataOutput)} produces for a matrix of the size. */
	static public long byteSize(int size)
	{
		return (long)size * size * Double.BYTES;
	}

	static public long pack(int row, int column)
	{
		return ((long)row << 32) | (column & 0xFFFFFFFFL);
	}

	static public int row(long entry)
	{
		return (int)(entry >>> 32);
	}

	static public int column(long entry)
	{
		return (int)entry;
	}

	private void checkRange(int row, int column)
	{
		if (row < 0 || row >= rows.length || column < 0 || column >= rows.length)
			throw new IllegalArgumentException(String.format("Cell (%d, %d) out of [0, %d)", row, column, rows.length));
	}

	@Override
	public boolean equals(Object obj)
	{
		return obj instanceof SparseMatrix && Arrays.equals(rows, ((SparseMatrix)obj).rows);
	}

	@Override
	public int hashCode()
	{
		return Arrays.hashCode(rows);
	}
}
