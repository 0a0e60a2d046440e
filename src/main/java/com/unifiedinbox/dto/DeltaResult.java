package com.unifiedinbox.dto;

import com.unifiedinbox.entity.SyncCursor;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * One fetch from a provider: raw records, the cursor to resume from next time,
 * and whether the provider returned a full window or only changes.
 */
@Data
@AllArgsConstructor
public class DeltaResult<C extends SyncCursor> {
    private List<Map<String, Object>> records;
    private C nextCursor;
    private FetchMode mode;
}
