package com.mailsync.mapper;

import com.mailsync.domain.EmailAccount;
import com.mailsync.domain.SyncStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface EmailAccountMapper {

    void insert(EmailAccount account);

    EmailAccount findById(@Param("id") long id);

    EmailAccount findActiveById(@Param("id") long id);

    List<EmailAccount> findActive();

    void updateSyncStatus(@Param("id") long id, @Param("syncStatus") SyncStatus syncStatus);

    void markSyncSucceeded(@Param("id") long id,
                           @Param("syncStatus") SyncStatus syncStatus,
                           @Param("syncErrorDetails") String syncErrorDetails,
                           @Param("syncedAt") String syncedAt);

    /**
     * Flip initialSyncCompleted once; returns 0 when another run already did it
     */
    int markInitialSyncCompleted(@Param("id") long id, @Param("webhookEnabledAt") String webhookEnabledAt);

    void markSyncFailed(@Param("id") long id,
                        @Param("syncStatus") SyncStatus syncStatus,
                        @Param("syncErrorDetails") String syncErrorDetails,
                        @Param("lastError") String lastError,
                        @Param("attemptedAt") String attemptedAt);

    void markNeedsReconnection(@Param("id") long id,
                               @Param("lastError") String lastError,
                               @Param("attemptedAt") String attemptedAt);
}
