package org.javai.extparams.batch;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.extparams.placeholder.PlaceholderMatch;

/**
 * Placeholder usage across a spec directory.
 *
 * @param sourceCounts occurrences per declared source, in order of first appearance
 * @param mostUsedSources the same counts ordered by frequency, highest first
 */
public record PlaceholderStatistics(int totalFiles, int filesWithPlaceholders, int totalPlaceholders,
		Map<String, Integer> sourceCounts, List<SourceCount> mostUsedSources, List<Occurrence> details) {

	public PlaceholderStatistics {
		sourceCounts = Collections.unmodifiableMap(new LinkedHashMap<>(sourceCounts));
		mostUsedSources = List.copyOf(mostUsedSources);
		details = List.copyOf(details);
	}

	public record SourceCount(String source, int count) {
	}

	public record Occurrence(Path file, PlaceholderMatch match) {
	}
}
