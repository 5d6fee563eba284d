package org.calista.archives.lore.entry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bookkeeping carried by every entry. Timestamps are ISO-8601 strings as written by the manager.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EntryMetadata {

    public static final String STATUS_DRAFT = "draft";

    @JsonProperty("created_date")
    public String createdDate;

    @JsonProperty("modified_date")
    public String modifiedDate;

    public String author;

    public int version = 1;

    public String status = STATUS_DRAFT;

    public EntryMetadata copy() {
        EntryMetadata m = new EntryMetadata();
        m.createdDate = createdDate;
        m.modifiedDate = modifiedDate;
        m.author = author;
        m.version = version;
        m.status = status;
        return m;
    }

    void normalize() {
        if (version < 1) version = 1;
        if (status == null || status.isBlank()) status = STATUS_DRAFT;
    }
}
