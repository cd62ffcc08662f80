package org.janelia.saalfeldlab.label.stitching.stitch;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;

import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.broadcast.Broadcast;
import org.apache.spark.storage.StorageLevel;
import org.janelia.saalfeldlab.label.stitching.exception.MalformedBoundaryGroupException;
import org.janelia.saalfeldlab.label.stitching.mapping.PartialMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import scala.Tuple2;

/**
 * Stitch independently labeled subvolumes into a globally consistent labeling.
 *
 * <ol>
 *     <li>Offset each subvolume's labels so that label ranges are disjoint.</li>
 *     <li>Extract the overlap of each pair of neighboring subvolumes.</li>
 *     <li>Find labels that continue across each boundary.</li>
 *     <li>Resolve all merges on the driver.</li>
 *     <li>Relabel each subvolume.</li>
 * </ol>
 *
 * Only the last step is lazy. The returned RDD depends on {@code labelChunks}, which is cached if it is not
 * persisted already.
 */
public class Stitcher {

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	private Stitcher() {

	}

	public static JavaRDD<LabeledSubvolume> stitch(final JavaSparkContext sc, final JavaRDD<LabeledSubvolume> labelChunks) {

		if (StorageLevel.NONE().equals(labelChunks.getStorageLevel())) {
			LOG.warn("Label chunks are not persisted and would be computed multiple times. Caching them.");
			labelChunks.cache();
		}

		try {
			final List<Tuple2<Integer, Long>> maxIds = labelChunks
					.map(chunk -> new Tuple2<>(chunk.subvolume().index(), chunk.maxId()))
					.collect();
			final OffsetAssignment offsets = OffsetAssignment.fromMaxIds(maxIds);
			LOG.info("Assigned offsets to {} subvolumes with {} labels in total", offsets.size(), offsets.totalMaxId());
			final Broadcast<OffsetAssignment> offsetsBroadcast = sc.broadcast(offsets);

			final List<MergeEdge> edges = new ArrayList<>(labelChunks
					.flatMapToPair(new BoundaryExtraction())
					.groupByKey()
					.mapToPair(new PairwiseMerge(offsetsBroadcast))
					.reduceByKey((edges1, edges2) -> {
						edges1.addAll(edges2);
						return edges1;
					})
					.values()
					.flatMap(ArrayList::iterator)
					.collect());
			LOG.info("Collected {} merge edges", edges.size());

			final PartialMapping equivalences = GlobalReconciliation.reconcile(edges);
			LOG.info("Merging {} labels", equivalences.size());
			final Broadcast<PartialMapping> equivalencesBroadcast = sc.broadcast(equivalences);

			return labelChunks.map(new RelabelSubvolume(offsetsBroadcast, equivalencesBroadcast));
		} catch (final Exception e) {
			throw unwrap(e);
		}
	}

	/**
	 * Errors in Spark tasks reach the driver wrapped in a {@code SparkException}. Rethrow
	 * {@link MalformedBoundaryGroupException} as is.
	 */
	static RuntimeException unwrap(final Exception e) {

		for (Throwable cause = e; cause != null; cause = cause.getCause()) {
			if (cause instanceof MalformedBoundaryGroupException)
				return (MalformedBoundaryGroupException)cause;
			// the task failure might only carry the message if the cause was not deserialized
			if (cause.getMessage() != null && cause.getMessage().contains(MalformedBoundaryGroupException.class.getName()))
				return new MalformedBoundaryGroupException(cause.getMessage());
		}
		return e instanceof RuntimeException ? (RuntimeException)e : new RuntimeException(e);
	}
}
