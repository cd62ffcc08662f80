package org.janelia.saalfeldlab.label.stitching.mapping;

import org.janelia.saalfeldlab.label.stitching.exception.IncompleteMappingException;
import org.janelia.saalfeldlab.label.stitching.exception.NonReversibleMappingException;

import gnu.trove.map.TLongLongMap;
import gnu.trove.map.hash.TLongLongHashMap;
import gnu.trove.procedure.TLongLongProcedure;

/**
 * Mapping that is defined for every label it may be asked about. Looking up a label that is not a key
 * is a consistency error and throws {@link IncompleteMappingException}.
 */
public class TotalMapping extends LabelMapping {

	private static final long serialVersionUID = -6098721254730938317L;

	public TotalMapping(final TLongLongMap map) {

		super(map);
	}

	public static TotalMapping empty() {

		return new TotalMapping(new TLongLongHashMap());
	}

	public static TotalMapping identity(final long... labels) {

		final TLongLongHashMap map = new TLongLongHashMap(Math.max(labels.length, 1));
		for (final long label : labels)
			map.put(label, label);
		return new TotalMapping(map);
	}

	@Override
	public long apply(final long label) {

		if (!map.containsKey(label))
			throw new IncompleteMappingException(label);
		return map.get(label);
	}

	/**
	 * Substitute every value of this mapping through {@code next}.
	 *
	 * @throws IncompleteMappingException if a value of this mapping is not a key of {@code next}
	 */
	public TotalMapping andThen(final TotalMapping next) {

		final TLongLongHashMap composed = new TLongLongHashMap(Math.max(map.size(), 1));
		map.forEachEntry((k, v) -> {
			composed.put(k, next.apply(v));
			return true;
		});
		return new TotalMapping(composed);
	}

	/**
	 * Compose a chain A-&gt;B, B-&gt;C, ... into a single mapping A-&gt;Z.
	 */
	public static TotalMapping compose(final TotalMapping first, final TotalMapping... rest) {

		TotalMapping composed = first;
		for (final TotalMapping next : rest)
			composed = composed.andThen(next);
		return composed;
	}

	/**
	 * @throws NonReversibleMappingException if two keys share the same value
	 */
	public TotalMapping inverse() {

		final TLongLongHashMap inverse = new TLongLongHashMap(Math.max(map.size(), 1));
		map.forEachEntry((k, v) -> {
			if (inverse.containsKey(v))
				throw new NonReversibleMappingException(v, inverse.get(v), k);
			inverse.put(v, k);
			return true;
		});
		return new TotalMapping(inverse);
	}

	public TotalMapping filter(final TLongLongProcedure keep) {

		final TLongLongHashMap filtered = new TLongLongHashMap();
		map.forEachEntry((k, v) -> {
			if (keep.execute(k, v))
				filtered.put(k, v);
			return true;
		});
		return new TotalMapping(filtered);
	}

	public PartialMapping asPartial() {

		return new PartialMapping(map);
	}

	public static class Builder {

		private final TLongLongHashMap map = new TLongLongHashMap();

		public Builder put(final long key, final long value) {

			map.put(key, value);
			return this;
		}

		public Builder putAll(final LabelMapping mapping) {

			mapping.forEachEntry((k, v) -> {
				map.put(k, v);
				return true;
			});
			return this;
		}

		public TotalMapping build() {

			return new TotalMapping(map);
		}
	}
}
