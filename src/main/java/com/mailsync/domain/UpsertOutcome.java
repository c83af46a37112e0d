package com.mailsync.domain;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row returned by the message upsert statement
 */
@Data
@NoArgsConstructor
public class UpsertOutcome {

    private Long id;
    private int observationCount;   // 1 only for the statement that created the row

    public boolean isInserted() {
        return observationCount == 1;
    }
}
