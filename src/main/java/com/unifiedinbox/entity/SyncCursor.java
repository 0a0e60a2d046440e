package com.unifiedinbox.entity;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Opaque resume token for incremental fetch. Stored on the account as
 * {@code {"provider":"gmail","historyId":...}} or
 * {@code {"provider":"outlook","deltaLink":...}}; only the matching
 * provider adapter reads the payload.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "provider")
@JsonSubTypes({
    @JsonSubTypes.Type(value = GmailCursor.class, name = "gmail"),
    @JsonSubTypes.Type(value = OutlookCursor.class, name = "outlook")
})
public abstract class SyncCursor {
}
