package org.zimcorpus.archive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.zimcorpus.sharding.pipeline.ir.RecordEntry;

/**
 * One line of an archive manifest.
 *
 * <pre>{"index":12,"title":"Budapest","namespace":"A","redirect":false,"deleted":false,"blob":"A/Budapest.html"}</pre>
 *
 * {@code blob} is optional and defaults to {@code blobs/<index>}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManifestEntry(
    @JsonProperty(value = "index", required = true) long index,
    @JsonProperty("title") String title,
    @JsonProperty(value = "namespace", required = true) String namespace,
    @JsonProperty("redirect") boolean redirect,
    @JsonProperty("deleted") boolean deleted,
    @JsonProperty("blob") String blob
) {
    public static final String DEFAULT_BLOB_DIRECTORY = "blobs/";

    public String blobPath() {
        return blob != null ? blob : DEFAULT_BLOB_DIRECTORY + index;
    }

    public RecordEntry toRecordEntry() {
        return new RecordEntry(index, title, namespace, redirect, deleted);
    }
}
