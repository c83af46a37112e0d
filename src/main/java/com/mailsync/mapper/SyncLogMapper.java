package com.mailsync.mapper;

import com.mailsync.domain.SyncLogEntry;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface SyncLogMapper {

    void insert(SyncLogEntry entry);
}
