package dev.etfaggregator.store;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Manifest entry for one segment of a chunked dataset.
 *
 * @param file  segment file name, relative to the collection directory
 * @param count number of records in the segment
 * @param bytes serialized size of the segment
 * @param md5   hex MD5 of the segment bytes; absent in manifests written before it was recorded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SegmentInfo(String file, int count, long bytes, String md5) {
}
