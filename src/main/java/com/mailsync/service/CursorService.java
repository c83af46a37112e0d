package com.mailsync.service;

import com.mailsync.config.SyncProperties;
import com.mailsync.domain.FolderCursor;
import com.mailsync.mapper.FolderCursorMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Per account/folder UID cursor
 * - Created lazily at 0
 * - lastUidSynced never decreases (MAX in the upsert)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CursorService {

    private final FolderCursorMapper cursorMapper;
    private final SyncProperties properties;

    /**
     * Existing cursor, or a new one at UID 0
     */
    public FolderCursor get(long accountId, String folderName) {
        FolderCursor cursor = cursorMapper.findByAccountAndFolder(accountId, folderName);
        if (cursor != null) {
            return cursor;
        }
        if (cursorMapper.insertIfAbsent(accountId, folderName) > 0) {
            log.debug("Cursor created: account={}, folder={}", accountId, folderName);
        }
        return cursorMapper.findByAccountAndFolder(accountId, folderName);
    }

    /**
     * Move the cursor to max(stored, lastUid), store the total and clear error counters
     */
    public void advance(long accountId, String folderName, long lastUid, int totalCount) {
        cursorMapper.advance(accountId, folderName, lastUid, totalCount, Instant.now().toString());
        log.debug("Cursor advanced: account={}, folder={}, lastUid>={}, total={}", accountId, folderName, lastUid, totalCount);
    }

    public void recordError(long accountId, String folderName, String errorMessage) {
        cursorMapper.recordError(accountId, folderName, errorMessage, Instant.now().toString());
    }

    /**
     * Folders whose initial full sync completed; the default folder when there are none
     */
    public List<String> eligibleFolders(long accountId) {
        List<String> folders = cursorMapper.findInitiallySyncedFolders(accountId);
        if (folders == null || folders.isEmpty()) {
            return List.of(properties.getSync().getDefaultFolder());
        }
        return folders;
    }
}
