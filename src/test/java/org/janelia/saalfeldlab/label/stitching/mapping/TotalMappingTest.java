package org.janelia.saalfeldlab.label.stitching.mapping;

import org.janelia.saalfeldlab.label.stitching.exception.IncompleteMappingException;
import org.janelia.saalfeldlab.label.stitching.exception.NonReversibleMappingException;
import org.junit.Assert;
import org.junit.Test;

import gnu.trove.map.hash.TLongLongHashMap;

public class TotalMappingTest {

	@Test
	public void testCompose() {

		final TotalMapping first = new TotalMapping.Builder().put(1, 2).put(2, 3).build();
		final TotalMapping second = new TotalMapping.Builder().put(2, 20).put(3, 30).build();
		final TotalMapping third = new TotalMapping.Builder().put(20, 200).put(30, 300).build();

		final TotalMapping composed = TotalMapping.compose(first, second, third);
		Assert.assertEquals(new TotalMapping.Builder().put(1, 200).put(2, 300).build(), composed);
		Assert.assertEquals(first.andThen(second).andThen(third), composed);
		Assert.assertEquals(first, TotalMapping.compose(first));
	}

	@Test
	public void testComposeIncomplete() {

		final TotalMapping first = new TotalMapping.Builder().put(1, 2).build();
		final TotalMapping second = new TotalMapping.Builder().put(3, 4).build();
		try {
			first.andThen(second);
			Assert.fail("Expected " + IncompleteMappingException.class.getSimpleName());
		} catch (final IncompleteMappingException e) {
			Assert.assertEquals(2, e.getMissingKey());
		}
	}

	@Test(expected = IncompleteMappingException.class)
	public void testApplyMissingKey() {

		TotalMapping.identity(1, 2, 3).apply(4);
	}

	@Test
	public void testInverse() {

		final TotalMapping mapping = new TotalMapping.Builder().put(0, 0).put(1, 5).put(2, 7).build();
		final TotalMapping inverse = mapping.inverse();
		Assert.assertEquals(new TotalMapping.Builder().put(0, 0).put(5, 1).put(7, 2).build(), inverse);
		Assert.assertEquals(TotalMapping.identity(0, 1, 2), mapping.andThen(inverse));
	}

	@Test(expected = NonReversibleMappingException.class)
	public void testNonReversible() {

		new TotalMapping.Builder().put(1, 5).put(2, 5).build().inverse();
	}

	@Test
	public void testApplyInPlace() {

		final long[] labels = {0, 1, 2, 1};
		new TotalMapping.Builder().put(0, 0).put(1, 10).put(2, 20).build().applyInPlace(labels);
		Assert.assertArrayEquals(new long[]{0, 10, 20, 10}, labels);
	}

	@Test
	public void testFilterAndSortedKeys() {

		final TotalMapping mapping = new TotalMapping.Builder().put(9, 1).put(3, 1).put(5, 2).build();
		Assert.assertArrayEquals(new long[]{3, 5, 9}, mapping.sortedKeys());
		Assert.assertArrayEquals(new long[]{3, 9}, mapping.filter((k, v) -> v == 1).sortedKeys());
	}

	@Test
	public void testPartialPassesUnknownLabelsThrough() {

		final PartialMapping mapping = new TotalMapping.Builder().put(1, 5).build().asPartial();
		Assert.assertEquals(5, mapping.apply(1));
		Assert.assertEquals(2, mapping.apply(2));
		Assert.assertEquals(0, mapping.apply(0));
		Assert.assertEquals(7, PartialMapping.empty().apply(7));

		final long[] labels = {0, 1, 2};
		mapping.applyInPlace(labels);
		Assert.assertArrayEquals(new long[]{0, 5, 2}, labels);
	}

	@Test
	public void testMappingIsNotAffectedBySourceMap() {

		final TLongLongHashMap source = new TLongLongHashMap();
		source.put(1, 2);
		final TotalMapping mapping = new TotalMapping(source);
		source.put(1, 3);
		mapping.toMap().put(1, 4);
		Assert.assertEquals(2, mapping.apply(1));
	}
}
