package org.janelia.saalfeldlab.label.stitching.stitch;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.janelia.saalfeldlab.label.stitching.mapping.PartialMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gnu.trove.map.hash.TLongLongHashMap;
import gnu.trove.map.hash.TLongObjectHashMap;
import gnu.trove.set.hash.TLongHashSet;

/**
 * Resolve merge edges into a mapping from each merged label to the representative of its group.
 *
 * Edges are processed in sorted order. For each edge {@code (a, b)}, the current representatives of {@code a}
 * and {@code b} are looked up and the representative of {@code a}, together with all labels it represents,
 * is assigned to the representative of {@code b}. The resulting mapping is idempotent: every value is a
 * representative and not a key.
 */
public class GlobalReconciliation {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private GlobalReconciliation() {

	}

	public static PartialMapping reconcile(final Collection<MergeEdge> edges) {

		final List<MergeEdge> sorted = new ArrayList<>(edges);
		Collections.sort(sorted);

		final TLongLongHashMap representativeOf = new TLongLongHashMap();
		final TLongObjectHashMap<TLongHashSet> membersOf = new TLongObjectHashMap<>();

		for (final MergeEdge edge : sorted) {
			final long body1 = representativeOf.containsKey(edge.from()) ? representativeOf.get(edge.from()) : edge.from();
			final long body2 = representativeOf.containsKey(edge.to()) ? representativeOf.get(edge.to()) : edge.to();

			// already in the same group
			if (body1 == body2)
				continue;

			if (!membersOf.containsKey(body2))
				membersOf.put(body2, new TLongHashSet());
			final TLongHashSet members = membersOf.get(body2);
			members.add(body1);
			representativeOf.put(body1, body2);

			final TLongHashSet membersOfBody1 = membersOf.remove(body1);
			if (membersOfBody1 != null) {
				members.addAll(membersOfBody1);
				membersOfBody1.forEach(member -> {
					representativeOf.put(member, body2);
					return true;
				});
			}
		}

		LOG.debug("Reconciled {} merge edges into {} label assignments", sorted.size(), representativeOf.size());
		return new PartialMapping(representativeOf);
	}
}
