package com.mailsync.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Append-only record of one folder sync attempt
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncLogEntry {

    private Long id;
    private long accountId;
    private String folderName;
    private String syncType;
    private int emailsFetched;
    private int emailsSaved;
    private int emailsUpdated;
    private int errorsCount;
    private long durationMs;
    private String errorDetails;
    private String createdAt;
}
