package org.janelia.saalfeldlab.label.stitching.stitch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.janelia.saalfeldlab.label.stitching.mapping.PartialMapping;
import org.janelia.saalfeldlab.label.stitching.mapping.TotalMapping;
import org.junit.Assert;
import org.junit.Test;

import gnu.trove.map.hash.TLongLongHashMap;

public class GlobalReconciliationTest {

	@Test
	public void testChain() {

		final PartialMapping equivalences = GlobalReconciliation.reconcile(Arrays.asList(
				new MergeEdge(3, 5),
				new MergeEdge(1, 3),
				new MergeEdge(2, 3)));
		Assert.assertEquals(new TotalMapping.Builder().put(1, 5).put(2, 5).put(3, 5).build().asPartial(), equivalences);
	}

	@Test
	public void testLaterEdgeWins() {

		final PartialMapping equivalences = GlobalReconciliation.reconcile(Arrays.asList(
				new MergeEdge(1, 3),
				new MergeEdge(1, 4)));
		Assert.assertEquals(4, equivalences.apply(1));
		Assert.assertEquals(4, equivalences.apply(3));
		Assert.assertEquals(4, equivalences.apply(4));
		Assert.assertFalse(equivalences.containsKey(4));
	}

	@Test
	public void testEmpty() {

		Assert.assertTrue(GlobalReconciliation.reconcile(Collections.emptyList()).isEmpty());
	}

	@Test
	public void testRandomEdges() {

		final Random rng = new Random(42);
		final List<MergeEdge> edges = new ArrayList<>();
		for (int i = 0; i < 200; ++i) {
			final long from = 1 + rng.nextInt(150);
			final long to = from + 1 + rng.nextInt(50);
			edges.add(new MergeEdge(from, to));
		}

		final PartialMapping equivalences = GlobalReconciliation.reconcile(edges);

		// idempotent
		for (final long key : equivalences.sortedKeys()) {
			final long representative = equivalences.apply(key);
			Assert.assertEquals(representative, equivalences.apply(representative));
			Assert.assertFalse(equivalences.containsKey(representative));
		}

		// both ends of each edge end up in the same group
		for (final MergeEdge edge : edges)
			Assert.assertEquals(equivalences.apply(edge.from()), equivalences.apply(edge.to()));

		// groups are exactly the connected components of the edges
		final TLongLongHashMap parent = new TLongLongHashMap();
		for (final MergeEdge edge : edges) {
			final long r1 = find(parent, edge.from());
			final long r2 = find(parent, edge.to());
			if (r1 != r2)
				parent.put(r1, r2);
		}
		for (final MergeEdge edge1 : edges)
			for (final MergeEdge edge2 : edges)
				Assert.assertEquals(
						find(parent, edge1.from()) == find(parent, edge2.from()),
						equivalences.apply(edge1.from()) == equivalences.apply(edge2.from()));

		// input order does not matter
		final List<MergeEdge> shuffled = new ArrayList<>(edges);
		Collections.shuffle(shuffled, new Random(7));
		Assert.assertEquals(equivalences, GlobalReconciliation.reconcile(shuffled));
	}

	private static long find(final TLongLongHashMap parent, final long label) {

		long root = label;
		while (parent.containsKey(root))
			root = parent.get(root);
		return root;
	}
}
