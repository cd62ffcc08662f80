package org.janelia.saalfeldlab.label.stitching;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.util.Arrays;

import org.janelia.saalfeldlab.label.stitching.subvolume.Box;
import org.janelia.saalfeldlab.label.stitching.subvolume.Subvolume;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.imglib2.N5Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.view.Views;

/**
 * Read and write {@link LabelBlock}s for {@link Subvolume}s of an N5 label dataset.
 */
public class N5LabelBlocks {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private N5LabelBlocks() {

	}

	/**
	 * Read the labels of {@code subvolume} including its border. Voxels outside the dataset are 0.
	 */
	@SuppressWarnings("unchecked")
	public static <I extends IntegerType<I> & NativeType<I>> LabelBlock read(
			final N5Reader n5,
			final String dataset,
			final Subvolume subvolume) throws IOException {

		final RandomAccessibleInterval<I> labels = (RandomAccessibleInterval<I>)N5Utils.open(n5, dataset);
		LOG.debug("Reading subvolume {} with border from {}", subvolume.index(), dataset);
		return LabelBlock.copyOf(Views.interval(Views.extendZero(labels), subvolume.intervalWithBorder()));
	}

	/**
	 * Write the labels inside the box of {@code subvolume}, without border, into {@code dataset}. The box must be
	 * aligned with the block grid of {@code dataset}.
	 *
	 * @return the labels that were written
	 */
	public static LabelBlock write(
			final N5Writer n5,
			final String dataset,
			final DatasetAttributes attributes,
			final Subvolume subvolume,
			final LabelBlock labels) throws IOException {

		final Box box = subvolume.box();
		final int[] blockSize = attributes.getBlockSize();
		for (int d = 0; d < box.numDimensions(); ++d)
			if (box.min(d) % blockSize[d] != 0)
				throw new IllegalArgumentException("Subvolume " + box + " not aligned with block size " + Arrays.toString(blockSize));

		final LabelBlock cropped = labels.crop(box.interval());
		final long[] gridOffset = N5Helpers.blockPos(box.min(), blockSize);
		LOG.debug("Writing subvolume {} at grid offset {} into {}", subvolume.index(), gridOffset, dataset);
		N5Utils.saveBlock(cropped.img(), n5, dataset, attributes, gridOffset);
		return cropped;
	}
}
