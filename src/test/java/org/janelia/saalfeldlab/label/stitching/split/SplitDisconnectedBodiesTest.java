package org.janelia.saalfeldlab.label.stitching.split;

import java.util.Random;

import org.janelia.saalfeldlab.label.stitching.mapping.PartialMapping;
import org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping;
import org.junit.Assert;
import org.junit.Test;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.LongArray;
import net.imglib2.type.numeric.integer.UnsignedLongType;
import net.imglib2.type.numeric.integer.UnsignedShortType;

public class SplitDisconnectedBodiesTest {

	private static final long[] DIMS = {20, 10, 1};

	/**
	 * Label 5 in columns 0-9 and 11-13, label 9 in column 10, background elsewhere.
	 */
	private static ArrayImg<UnsignedLongType, LongArray> twoPieces() {

		final long[] labels = new long[(int)(DIMS[0] * DIMS[1] * DIMS[2])];
		for (int y = 0; y < DIMS[1]; ++y) {
			for (int x = 0; x < DIMS[0]; ++x) {
				final int index = y * (int)DIMS[0] + x;
				if (x < 10 || x >= 11 && x < 14)
					labels[index] = 5;
				else if (x == 10)
					labels[index] = 9;
			}
		}
		return ArrayImgs.unsignedLongs(labels, DIMS);
	}

	@Test
	public void testSmallerPieceGetsNewLabel() {

		final SplitDisconnectedBodies.SplitResult result = SplitDisconnectedBodies.split(twoPieces());
		final long[] split = result.labels().update(null).getCurrentStorageArray();
		for (int y = 0; y < DIMS[1]; ++y) {
			for (int x = 0; x < DIMS[0]; ++x) {
				final long label = split[y * (int)DIMS[0] + x];
				if (x < 10)
					Assert.assertEquals(5, label);
				else if (x == 10)
					Assert.assertEquals(9, label);
				else if (x < 14)
					Assert.assertEquals(10, label);
				else
					Assert.assertEquals(0, label);
			}
		}
		Assert.assertEquals(new TotalMapping.Builder().put(5, 5).put(10, 5).build(), result.newToOriginal());
		Assert.assertEquals(10, result.maxLabel());
	}

	@Test
	public void testMappingRestoresOriginal() {

		final Random rng = new Random(100);
		final long[] labels = new long[8 * 8 * 4];
		for (int i = 0; i < labels.length; ++i)
			labels[i] = rng.nextInt(4) == 0 ? 0 : 1 + rng.nextInt(6);
		final ArrayImg<UnsignedLongType, LongArray> original = ArrayImgs.unsignedLongs(labels.clone(), 8, 8, 4);

		final SplitDisconnectedBodies.SplitResult result = SplitDisconnectedBodies.split(original);
		Assert.assertFalse(result.newToOriginal().isEmpty());

		final long[] restored = result.labels().update(null).getCurrentStorageArray().clone();
		final PartialMapping newToOriginal = result.newToOriginal().asPartial();
		newToOriginal.applyInPlace(restored);
		Assert.assertArrayEquals(labels, restored);

		// every split label is connected
		final long[] components = ConnectedComponentsOfLabels.label(result.labels()).update(null).getCurrentStorageArray();
		final long[] split = result.labels().update(null).getCurrentStorageArray();
		final TotalMapping.Builder componentToLabel = new TotalMapping.Builder();
		final TotalMapping.Builder labelToComponent = new TotalMapping.Builder();
		for (int i = 0; i < split.length; ++i) {
			componentToLabel.put(components[i], split[i]);
			labelToComponent.put(split[i], components[i]);
		}
		Assert.assertEquals(componentToLabel.build().size(), labelToComponent.build().size());

		// new labels start after the largest original label
		for (final long key : result.newToOriginal().sortedKeys())
			Assert.assertTrue(key <= 6 ? result.newToOriginal().apply(key) == key : key <= result.maxLabel());
	}

	@Test
	public void testConnectedLabelsUnchanged() {

		final long[] labels = {
				1, 1, 2, 2,
				0, 1, 2, 0,
				3, 3, 0, 0
		};
		final SplitDisconnectedBodies.SplitResult result = SplitDisconnectedBodies.split(ArrayImgs.unsignedShorts(new short[]{1, 1, 2, 2, 0, 1, 2, 0, 3, 3, 0, 0}, 4, 3));
		Assert.assertArrayEquals(labels, result.labels().update(null).getCurrentStorageArray());
		Assert.assertTrue(result.newToOriginal().isEmpty());
		Assert.assertEquals(3, result.maxLabel());
	}

	@Test
	public void testLabelsAboveSignedRange() {

		final long large = 1L << 63;
		final long[] labels = {large, large, 0, 3, 3};
		final SplitDisconnectedBodies.SplitResult result = SplitDisconnectedBodies.split(ArrayImgs.unsignedLongs(labels.clone(), 5));
		Assert.assertArrayEquals(labels, result.labels().update(null).getCurrentStorageArray());
		Assert.assertTrue(result.newToOriginal().isEmpty());
		Assert.assertEquals(large, result.maxLabel());
	}

	@Test
	public void testAllBackground() {

		final ArrayImg<UnsignedShortType, ?> zeros = ArrayImgs.unsignedShorts(5, 4, 3);
		final SplitDisconnectedBodies.SplitResult result = SplitDisconnectedBodies.split(zeros);
		Assert.assertArrayEquals(new long[5 * 4 * 3], result.labels().update(null).getCurrentStorageArray());
		Assert.assertTrue(result.newToOriginal().isEmpty());
		Assert.assertEquals(0, result.maxLabel());
	}

	@Test
	public void testManyPieces() {

		final long[] labels = {7, 0, 7, 0, 7, 7};
		final SplitDisconnectedBodies.SplitResult result = SplitDisconnectedBodies.split(ArrayImgs.unsignedLongs(labels, 6));
		// the largest piece keeps the label, the others are numbered in scan order
		Assert.assertArrayEquals(new long[]{8, 0, 9, 0, 7, 7}, result.labels().update(null).getCurrentStorageArray());
		Assert.assertEquals(new TotalMapping.Builder().put(7, 7).put(8, 7).put(9, 7).build(), result.newToOriginal());
	}
}
