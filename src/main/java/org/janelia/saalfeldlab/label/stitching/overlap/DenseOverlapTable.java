package org.janelia.saalfeldlab.label.stitching.overlap;

import java.util.ArrayList;
import java.util.List;

import org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping;

import gnu.trove.list.array.TLongArrayList;

/**
 * Array backed overlap table for label ranges {@code 0..numRows-1} and {@code 0..numCols-1}.
 */
public class DenseOverlapTable implements OverlapTable {

	private final long[][] counts;

	private final int numCols;

	DenseOverlapTable(final int numRows, final int numCols) {

		this.counts = new long[numRows][numCols];
		this.numCols = numCols;
	}

	void add(final long row, final long col) {

		++counts[(int)row][(int)col];
	}

	@Override
	public long count(final long row, final long col) {

		return contains(row, col) ? counts[(int)row][(int)col] : 0;
	}

	@Override
	public long rowSum(final long row) {

		if (!contains(row, 0))
			return 0;
		long sum = 0;
		for (final long count : counts[(int)row])
			sum += count;
		return sum;
	}

	@Override
	public long[] rows() {

		final TLongArrayList rows = new TLongArrayList();
		for (int row = 0; row < counts.length; ++row)
			if (rowSum(row) > 0)
				rows.add(row);
		return rows.toArray();
	}

	@Override
	public TotalMapping argMaxPerRow() {

		final TotalMapping.Builder argMax = new TotalMapping.Builder();
		for (int row = 0; row < counts.length; ++row) {
			long maxCount = 0;
			int argMaxCol = -1;
			for (int col = 0; col < numCols; ++col) {
				if (counts[row][col] > maxCount) {
					maxCount = counts[row][col];
					argMaxCol = col;
				}
			}
			if (argMaxCol >= 0)
				argMax.put(row, argMaxCol);
		}
		return argMax.build();
	}

	@Override
	public List<long[]> nonZeroEntries() {

		final List<long[]> entries = new ArrayList<>();
		forEachEntry((row, col, count) -> entries.add(new long[]{row, col}));
		return entries;
	}

	@Override
	public boolean forEachEntry(final EntryProcedure procedure) {

		for (int row = 0; row < counts.length; ++row)
			for (int col = 0; col < numCols; ++col)
				if (counts[row][col] != 0 && !procedure.execute(row, col, counts[row][col]))
					return false;
		return true;
	}

	private boolean contains(final long row, final long col) {

		return row >= 0 && row < counts.length && col >= 0 && col < numCols;
	}
}
