package org.javai.extparams.batch;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Naming rules for spec documents.
 */
public final class SpecFiles {

	/** Extensions of documents whose placeholders are resolved; everything else is copied. */
	public static final List<String> SPEC_EXTENSIONS = List.of(".spec", ".md");

	private SpecFiles() {
	}

	public static boolean isSpecFile(Path file) {
		return SPEC_EXTENSIONS.contains(extension(file).toLowerCase(Locale.ROOT));
	}

	/**
	 * {@code dir/name.ext} becomes {@code dir/name_resolved.ext}.
	 */
	public static Path defaultOutputPath(Path file) {
		String ext = extension(file);
		String fileName = file.getFileName().toString();
		String base = fileName.substring(0, fileName.length() - ext.length());
		return file.resolveSibling(base + "_resolved" + ext);
	}

	static String extension(Path file) {
		String name = file.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return dot <= 0 ? "" : name.substring(dot);
	}
}
