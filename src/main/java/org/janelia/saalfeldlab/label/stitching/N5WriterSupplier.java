package org.janelia.saalfeldlab.label.stitching;

import java.io.Serializable;
import java.util.function.Function;
import java.util.function.Supplier;

import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Writer;

import com.google.gson.GsonBuilder;

/**
 * Serializable handle to an N5 container that opens a writer wherever it is called, e.g. inside Spark tasks.
 */
public class N5WriterSupplier implements Supplier<N5Writer>, Serializable {

	private static final long serialVersionUID = 2837640512391826074L;

	private final String container;

	private final boolean withPrettyPrinting;

	private final boolean disableHtmlEscaping;

	public N5WriterSupplier(final String container) {

		this(container, true, true);
	}

	public N5WriterSupplier(final String container, final boolean withPrettyPrinting, final boolean disableHtmlEscaping) {

		this.container = container;
		this.withPrettyPrinting = withPrettyPrinting;
		this.disableHtmlEscaping = disableHtmlEscaping;
	}

	@Override
	public N5Writer get() {

		return new N5FSWriter(container, createBuilder());
	}

	private GsonBuilder createBuilder() {

		return withPrettyPrinting(disableHtmlEscaping(new GsonBuilder()));
	}

	private GsonBuilder withPrettyPrinting(final GsonBuilder builder) {

		return with(builder, this.withPrettyPrinting, GsonBuilder::setPrettyPrinting);
	}

	private GsonBuilder disableHtmlEscaping(final GsonBuilder builder) {

		return with(builder, this.disableHtmlEscaping, GsonBuilder::disableHtmlEscaping);
	}

	private static GsonBuilder with(final GsonBuilder builder, final boolean applyAction, final Function<GsonBuilder, GsonBuilder> action) {

		return applyAction ? action.apply(builder) : builder;
	}
}
