package org.janelia.saalfeldlab.label.stitching.overlap;

import java.util.List;

import org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping;

/**
 * Contingency table of co-occurring labels of two label volumes with identical shape. Rows are labels of the
 * first volume, columns are labels of the second volume, entries are voxel counts.
 */
public interface OverlapTable {

	interface EntryProcedure {

		boolean execute(long row, long col, long count);
	}

	long count(long row, long col);

	/**
	 * @return number of voxels with label {@code row} in the first volume
	 */
	long rowSum(long row);

	/**
	 * @return sorted labels of the first volume that have at least one entry
	 */
	long[] rows();

	/**
	 * For each row with at least one entry, the column with the highest count. Ties are broken in favor
	 * of the lowest column.
	 */
	TotalMapping argMaxPerRow();

	/**
	 * @return all {@code (row, col)} with non-zero count, sorted by row and then by column
	 */
	List<long[]> nonZeroEntries();

	boolean forEachEntry(EntryProcedure procedure);

}
