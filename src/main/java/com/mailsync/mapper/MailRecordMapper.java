package com.mailsync.mapper;

import com.mailsync.domain.MailRecord;
import com.mailsync.domain.UpsertOutcome;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface MailRecordMapper {

    /**
     * INSERT ... ON CONFLICT DO UPDATE ... RETURNING id, observation_count
     */
    UpsertOutcome upsert(MailRecord record);

    MailRecord findByProviderMessageId(@Param("accountId") long accountId,
                                       @Param("providerMessageId") String providerMessageId);

    void updateFlags(@Param("id") long id,
                     @Param("isRead") int isRead,
                     @Param("isStarred") int isStarred,
                     @Param("updatedAt") String updatedAt);
}
