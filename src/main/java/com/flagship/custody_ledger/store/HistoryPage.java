package com.flagship.custody_ledger.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * A slice of history, most recent first. Pass {@code nextCursor} back as the
 * {@code before} argument to continue; it is null on the last page.
 */
@Value
public class HistoryPage {

    @JsonProperty("entries")
    List<HistoryEntry> entries;

    @JsonProperty("next_cursor")
    Long nextCursor;
}
