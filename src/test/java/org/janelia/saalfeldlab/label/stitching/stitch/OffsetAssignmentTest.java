package org.janelia.saalfeldlab.label.stitching.stitch;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import scala.Tuple2;

public class OffsetAssignmentTest {

	@Test
	public void testOffsetsInIndexOrder() {

		final OffsetAssignment offsets = OffsetAssignment.fromMaxIds(Arrays.asList(
				new Tuple2<>(2, 5L),
				new Tuple2<>(0, 3L),
				new Tuple2<>(1, 0L),
				new Tuple2<>(3, 4L)));

		Assert.assertEquals(4, offsets.size());
		Assert.assertEquals(0, offsets.offset(0));
		Assert.assertEquals(3, offsets.offset(1));
		Assert.assertEquals(3, offsets.offset(2));
		Assert.assertEquals(8, offsets.offset(3));
		Assert.assertEquals(12, offsets.totalMaxId());
	}

	@Test
	public void testLabelRangesDoNotOverlap() {

		final List<Tuple2<Integer, Long>> maxIds = Arrays.asList(
				new Tuple2<>(0, 10L),
				new Tuple2<>(1, 1L),
				new Tuple2<>(2, 7L),
				new Tuple2<>(3, 0L),
				new Tuple2<>(4, 2L));
		final OffsetAssignment offsets = OffsetAssignment.fromMaxIds(maxIds);
		for (final Tuple2<Integer, Long> first : maxIds) {
			for (final Tuple2<Integer, Long> second : maxIds) {
				if (first._1() >= second._1())
					continue;
				// labels 1..maxId of the first subvolume end before the first label of the second
				Assert.assertTrue(offsets.offset(first._1()) + first._2() < offsets.offset(second._1()) + 1);
			}
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDuplicateIndex() {

		OffsetAssignment.fromMaxIds(Arrays.asList(new Tuple2<>(0, 1L), new Tuple2<>(0, 2L)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownIndex() {

		OffsetAssignment.fromMaxIds(Arrays.asList(new Tuple2<>(0, 1L))).offset(1);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMaxIdAboveSignedRange() {

		OffsetAssignment.fromMaxIds(Arrays.asList(new Tuple2<>(0, 1L), new Tuple2<>(1, 1L << 63)));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testOffsetOverflow() {

		OffsetAssignment.fromMaxIds(Arrays.asList(new Tuple2<>(0, Long.MAX_VALUE), new Tuple2<>(1, 1L), new Tuple2<>(2, 1L)));
	}
}
