package com.unifiedinbox.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class OutlookCursor extends SyncCursor {

    // Full Graph URL, including the $deltatoken
    private String deltaLink;
}
