package org.janelia.saalfeldlab.label.stitching.mapping;

import java.io.Serializable;
import java.util.Arrays;

import gnu.trove.map.TLongLongMap;
import gnu.trove.map.hash.TLongLongHashMap;
import gnu.trove.procedure.TLongLongProcedure;

/**
 * Immutable finite mapping between label ids, backed by a {@link TLongLongHashMap}.
 * Subclasses decide what happens to labels that are not keys of the mapping.
 */
public abstract class LabelMapping implements Serializable {

	private static final long serialVersionUID = 2713982349510285513L;

	protected final TLongLongHashMap map;

	protected LabelMapping(final TLongLongMap map) {

		this.map = new TLongLongHashMap(map);
	}

	public abstract long apply(long label);

	public boolean containsKey(final long label) {

		return map.containsKey(label);
	}

	public int size() {

		return map.size();
	}

	public boolean isEmpty() {

		return map.isEmpty();
	}

	public long[] sortedKeys() {

		final long[] keys = map.keys();
		Arrays.sort(keys);
		return keys;
	}

	public boolean forEachEntry(final TLongLongProcedure procedure) {

		return map.forEachEntry(procedure);
	}

	/**
	 * @return a mutable copy of the underlying map
	 */
	public TLongLongMap toMap() {

		return new TLongLongHashMap(map);
	}

	public void applyInPlace(final long[] labels) {

		for (int i = 0; i < labels.length; ++i)
			labels[i] = apply(labels[i]);
	}

	@Override
	public boolean equals(final Object other) {

		return other != null && other.getClass() == getClass() && map.equals(((LabelMapping)other).map);
	}

	@Override
	public int hashCode() {

		return map.hashCode();
	}

	@Override
	public String toString() {

		final StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append("{");
		final long[] keys = sortedKeys();
		for (int i = 0; i < keys.length; ++i) {
			if (i > 0)
				sb.append(", ");
			sb.append(keys[i]).append("->").append(map.get(keys[i]));
		}
		return sb.append("}").toString();
	}
}
