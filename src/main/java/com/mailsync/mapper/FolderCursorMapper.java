package com.mailsync.mapper;

import com.mailsync.domain.FolderCursor;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface FolderCursorMapper {

    FolderCursor findByAccountAndFolder(@Param("accountId") long accountId, @Param("folderName") String folderName);

    int insertIfAbsent(@Param("accountId") long accountId, @Param("folderName") String folderName);

    /**
     * Upsert that keeps lastUidSynced at MAX(stored, given)
     */
    void advance(@Param("accountId") long accountId,
                 @Param("folderName") String folderName,
                 @Param("lastUid") long lastUid,
                 @Param("totalCount") int totalCount,
                 @Param("syncedAt") String syncedAt);

    void recordError(@Param("accountId") long accountId,
                     @Param("folderName") String folderName,
                     @Param("errorMessage") String errorMessage,
                     @Param("updatedAt") String updatedAt);

    List<String> findInitiallySyncedFolders(@Param("accountId") long accountId);
}
