package com.example.logstore.storage.segment;

import java.util.List;

/**
 * A window over the raw lines of a segment.
 *
 * @param lines matching lines inside the requested window
 * @param total number of lines matching the filter in the whole segment
 */
public record LinesPage(List<String> lines, int total) {
}
