package org.janelia.saalfeldlab.label.stitching.stitch;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import org.apache.commons.lang3.time.DurationFormatUtils;
import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaRDD;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.storage.StorageLevel;
import org.janelia.saalfeldlab.label.stitching.N5Helpers;
import org.janelia.saalfeldlab.label.stitching.N5LabelBlocks;
import org.janelia.saalfeldlab.label.stitching.N5WriterSupplier;
import org.janelia.saalfeldlab.label.stitching.exception.InputSameAsOutput;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidDataType;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidDataset;
import org.janelia.saalfeldlab.label.stitching.exception.InvalidN5Container;
import org.janelia.saalfeldlab.label.stitching.subvolume.Subvolume;
import org.janelia.saalfeldlab.label.stitching.subvolume.SubvolumePartition;
import org.janelia.saalfeldlab.label.stitching.subvolume.SubvolumePartition.PartitionFilter;
import org.janelia.saalfeldlab.n5.DatasetAttributes;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;

/**
 * Partition an N5 label dataset into subvolumes, label each subvolume independently, stitch the subvolumes and
 * write the globally consistent labels into an output dataset.
 */
public class SparkStitchLabels {

	public static final String RUN_INFO_KEY = "label-stitching-spark";

	private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

	public enum Segmentation {

		CONNECTED_COMPONENTS(new ConnectedComponentsSegmenter()),
		CONSECUTIVE(new ConsecutiveSegmenter());

		private final BlockSegmenter segmenter;

		Segmentation(final BlockSegmenter segmenter) {

			this.segmenter = segmenter;
		}

		public BlockSegmenter segmenter() {

			return segmenter;
		}
	}

	private static class Args {

		@CommandLine.Parameters(arity = "1", paramLabel = "INPUT_CONTAINER", description = "Path to N5 container with label dataset.")
		String inputContainer = null;

		@CommandLine.Option(names = "--input-dataset", paramLabel = "INPUT_DATASET", description = "Path of label dataset in INPUT_CONTAINER.")
		String inputDataset = "volumes/labels/input";

		@CommandLine.Option(names = "--output-container", paramLabel = "OUTPUT_CONTAINER", description = "Path to output container. Defaults to INPUT_CONTAINER.")
		String outputContainer = null;

		@CommandLine.Option(names = "--output-dataset", paramLabel = "OUTPUT_DATASET", description = "Path of stitched labels in OUTPUT_CONTAINER.")
		String outputDataset = "volumes/labels/stitched";

		@CommandLine.Option(names = "--block-size", paramLabel = "BLOCK_SIZE", description = "Block size of output.", split = ",")
		int[] blockSize = {64, 64, 64};

		@CommandLine.Option(names = "--blocks-per-task", paramLabel = "BLOCKS_PER_TASK", description = "How many blocks make up one subvolume (one value per dimension).", split = ",")
		int[] blocksPerTask = {1, 1, 1};

		@CommandLine.Option(names = "--border", paramLabel = "BORDER", description = "Border that is added to each subvolume on all sides. Labels are only merged across subvolumes if this is at least 1. Defaults to 1.")
		long border = 1;

		@CommandLine.Option(names = "--partition-filter", paramLabel = "FILTER", description = "Which subvolumes to process: ${COMPLETION-CANDIDATES}. Defaults to ALL.")
		PartitionFilter partitionFilter = PartitionFilter.ALL;

		@CommandLine.Option(names = "--segmentation", paramLabel = "SEGMENTATION", description = "How to label each subvolume: ${COMPLETION-CANDIDATES}. Defaults to CONNECTED_COMPONENTS.")
		Segmentation segmentation = Segmentation.CONNECTED_COMPONENTS;

		@CommandLine.Option(names = {"-h", "--help"}, usageHelp = true, description = "display a help message")
		boolean helpRequested;
	}

	public static void main(final String[] argv) throws Exception {

		run(argv);

	}

	public static void run(final String... argv) throws IOException, InvalidN5Container, InvalidDataset, InvalidDataType, InputSameAsOutput {

		final Args args = new Args();
		final CommandLine cmdLine = new CommandLine(args).setCaseInsensitiveEnumValuesAllowed(true);
		cmdLine.parseArgs(argv);
		if (cmdLine.isUsageHelpRequested()) {
			cmdLine.usage(System.err);
			return;
		}

		final long startTime = System.currentTimeMillis();
		final SparkConf conf = new SparkConf().setAppName(MethodHandles.lookup().lookupClass().getName());
		try (final JavaSparkContext sc = new JavaSparkContext(conf)) {
			run(sc, args, argv);
		}
		final String formattedTime = DurationFormatUtils.formatDuration(System.currentTimeMillis() - startTime, "HH:mm:ss.SSS");
		LOG.info("Stitched {}:{} into {} in {}", args.inputContainer, args.inputDataset, args.outputDataset, formattedTime);
	}

	/**
	 * Run with an existing Spark context.
	 *
	 * @return max id of the stitched labels
	 */
	public static long run(final JavaSparkContext sc, final String... argv) throws IOException, InvalidN5Container, InvalidDataset, InvalidDataType, InputSameAsOutput {

		final Args args = new Args();
		new CommandLine(args).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(argv);
		return run(sc, args, argv);
	}

	private static long run(final JavaSparkContext sc, final Args args, final String[] argv) throws IOException, InvalidN5Container, InvalidDataset, InvalidDataType, InputSameAsOutput {

		if (args.inputContainer == null)
			throw new InvalidN5Container("INPUT_CONTAINER", args.inputContainer);

		final String outputContainer = args.outputContainer == null ? args.inputContainer : args.outputContainer;
		if (Paths.get(args.inputContainer).toAbsolutePath().normalize().equals(Paths.get(outputContainer).toAbsolutePath().normalize())
				&& normalizeDataset(args.inputDataset).equals(normalizeDataset(args.outputDataset)))
			throw new InputSameAsOutput(args.inputContainer, args.inputDataset);

		final N5WriterSupplier n5in = new N5WriterSupplier(args.inputContainer);
		final N5WriterSupplier n5out = new N5WriterSupplier(outputContainer);
		final DatasetAttributes inputAttributes = N5Helpers.validateLabelDataset(n5in.get(), args.inputContainer, args.inputDataset);
		final long[] dimensions = inputAttributes.getDimensions();

		if (args.blockSize.length != dimensions.length || args.blocksPerTask.length != dimensions.length)
			throw new IllegalArgumentException(String.format(
					"Block size %s and blocks per task %s inconsistent with dimensions %s",
					Arrays.toString(args.blockSize),
					Arrays.toString(args.blocksPerTask),
					Arrays.toString(dimensions)));

		final Map<String, Object> runInfo = new HashMap<>();
		runInfo.put(N5Helpers.ARGV_KEY, argv);
		runInfo.put("inputContainer", args.inputContainer);
		runInfo.put("inputDataset", args.inputDataset);
		final Map<String, Object> additionalAttributes = new HashMap<>();
		additionalAttributes.put(RUN_INFO_KEY, runInfo);
		N5Helpers.prepareOutputDataset(n5out.get(), args.outputDataset, dimensions, args.blockSize, additionalAttributes);

		final long maxId = run(
				sc,
				n5in,
				n5out,
				args.inputDataset,
				args.outputDataset,
				dimensions,
				args.blockSize,
				args.blocksPerTask,
				args.border,
				args.partitionFilter,
				args.segmentation.segmenter());

		n5out.get().setAttribute(args.outputDataset, N5Helpers.MAX_ID_KEY, maxId);
		return maxId;
	}

	public static long run(
			final JavaSparkContext sc,
			final N5WriterSupplier n5in,
			final N5WriterSupplier n5out,
			final String inputDataset,
			final String outputDataset,
			final long[] dimensions,
			final int[] blockSize,
			final int[] blocksPerTask,
			final long border,
			final PartitionFilter partitionFilter,
			final BlockSegmenter segmenter) {

		final int[] subvolumeSize = IntStream.range(0, blockSize.length).map(d -> blockSize[d] * blocksPerTask[d]).toArray();
		final List<Subvolume> subvolumes = SubvolumePartition.gridAligned(dimensions, subvolumeSize, border, partitionFilter);
		LOG.info("Stitching {} subvolumes of size {} with border {}", subvolumes.size(), subvolumeSize, border);

		final JavaRDD<LabeledSubvolume> labelChunks = sc
				.parallelize(subvolumes, Math.max(subvolumes.size(), 1))
				.map(subvolume -> segmenter.segment(subvolume, N5LabelBlocks.read(n5in.get(), inputDataset, subvolume)))
				.persist(StorageLevel.MEMORY_AND_DISK());

		final JavaRDD<LabeledSubvolume> stitched = Stitcher.stitch(sc, labelChunks);

		final long maxId = stitched
				.map(labeledSubvolume -> {
					final N5Writer n5 = n5out.get();
					return N5LabelBlocks
							.write(n5, outputDataset, n5.getDatasetAttributes(outputDataset), labeledSubvolume.subvolume(), labeledSubvolume.labels())
							.maxLabel();
				})
				.fold(0L, (m1, m2) -> Long.compareUnsigned(m1, m2) >= 0 ? m1 : m2);

		labelChunks.unpersist();
		LOG.info("Wrote stitched labels with max id {} into {}", maxId, outputDataset);
		return maxId;
	}

	private static String normalizeDataset(final String dataset) {

		return dataset.replaceAll("^/+", "").replaceAll("/+$", "");
	}
}
