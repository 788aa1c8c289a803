package dev.etfaggregator.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Metadata describing one stored dataset: freshness, size and segmentation.
 * Written as {@code <kind>_metadata.json} next to the segments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatasetManifest {

    private String collection;
    private String kind;
    private Instant updatedAt;
    private int recordCount;
    private long totalBytes;
    private SerializationFormat format;
    private boolean chunked;

    // Single-segment datasets only
    private String file;
    private String md5;

    // Chunked datasets only
    private Integer chunkCount;
    private List<SegmentInfo> chunks;

    public int segmentCount() {
        return chunked && chunkCount != null ? chunkCount : 1;
    }
}
