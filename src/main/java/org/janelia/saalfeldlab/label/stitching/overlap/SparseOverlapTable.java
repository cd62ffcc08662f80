package org.janelia.saalfeldlab.label.stitching.overlap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping;

import gnu.trove.iterator.TLongLongIterator;
import gnu.trove.map.hash.TLongLongHashMap;
import gnu.trove.map.hash.TLongObjectHashMap;

public class SparseOverlapTable implements OverlapTable {

	private final TLongObjectHashMap<TLongLongHashMap> rows = new TLongObjectHashMap<>();

	void add(final long row, final long col) {

		TLongLongHashMap cols = rows.get(row);
		if (cols == null) {
			cols = new TLongLongHashMap();
			rows.put(row, cols);
		}
		cols.adjustOrPutValue(col, 1, 1);
	}

	@Override
	public long count(final long row, final long col) {

		final TLongLongHashMap cols = rows.get(row);
		return cols == null ? 0 : cols.get(col);
	}

	@Override
	public long rowSum(final long row) {

		final TLongLongHashMap cols = rows.get(row);
		if (cols == null)
			return 0;
		long sum = 0;
		for (final long count : cols.values())
			sum += count;
		return sum;
	}

	@Override
	public long[] rows() {

		final long[] keys = rows.keys();
		Arrays.sort(keys);
		return keys;
	}

	@Override
	public TotalMapping argMaxPerRow() {

		final TotalMapping.Builder argMax = new TotalMapping.Builder();
		rows.forEachEntry((row, cols) -> {
			long maxCount = Long.MIN_VALUE;
			long argMaxCol = 0;
			for (final TLongLongIterator it = cols.iterator(); it.hasNext(); ) {
				it.advance();
				final long count = it.value();
				if (count > maxCount || count == maxCount && it.key() < argMaxCol) {
					maxCount = count;
					argMaxCol = it.key();
				}
			}
			argMax.put(row, argMaxCol);
			return true;
		});
		return argMax.build();
	}

	@Override
	public List<long[]> nonZeroEntries() {

		final List<long[]> entries = new ArrayList<>();
		for (final long row : rows()) {
			final long[] cols = rows.get(row).keys();
			Arrays.sort(cols);
			for (final long col : cols)
				entries.add(new long[]{row, col});
		}
		return entries;
	}

	@Override
	public boolean forEachEntry(final EntryProcedure procedure) {

		return rows.forEachEntry((row, cols) -> cols.forEachEntry((col, count) -> procedure.execute(row, col, count)));
	}
}
