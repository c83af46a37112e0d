package com.mailsync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per account/folder sync cursor
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FolderCursor {

    private Long id;
    private long accountId;
    private String folderName;
    private long lastUidSynced;      // 0 = never synced
    private int totalServerCount;
    private int initialSyncCompleted;
    private int syncErrorsCount;
    private String lastErrorMessage;
    private String lastSyncAt;
    private String updatedAt;
}
