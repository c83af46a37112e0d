package com.mailsync.mapper;

import com.mailsync.domain.EmailAccount;
import com.mailsync.domain.FolderCursor;
import com.mailsync.domain.MailRecord;
import com.mailsync.domain.SyncLogEntry;
import com.mailsync.domain.SyncStatus;
import com.mailsync.domain.UpsertOutcome;
import org.apache.ibatis.builder.xml.XMLMapperBuilder;
import org.apache.ibatis.mapping.Environment;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.transaction.jdbc.JdbcTransactionFactory;
import org.apache.ibatis.type.JdbcType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.sqlite.SQLiteDataSource;

import java.io.InputStream;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Mapper SQL against a real SQLite file
 */
class MapperSqliteTest {

    private static final String[] MAPPERS = {
            "mapper/EmailAccountMapper.xml", "mapper/FolderCursorMapper.xml",
            "mapper/MailRecordMapper.xml", "mapper/SyncLogMapper.xml"};

    @TempDir
    Path tempDir;

    private SqlSession session;
    private EmailAccountMapper accountMapper;
    private FolderCursorMapper cursorMapper;
    private MailRecordMapper recordMapper;
    private SyncLogMapper syncLogMapper;

    @BeforeEach
    void setUp() throws Exception {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("mailsync-test.db"));
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);

        Configuration configuration = new Configuration(new Environment("test", new JdbcTransactionFactory(), dataSource));
        configuration.setMapUnderscoreToCamelCase(true);
        configuration.setJdbcTypeForNull(JdbcType.NULL);
        for (String resource : MAPPERS) {
            try (InputStream in = new ClassPathResource(resource).getInputStream()) {
                new XMLMapperBuilder(in, configuration, resource, configuration.getSqlFragments()).parse();
            }
        }
        SqlSessionFactory factory = new SqlSessionFactoryBuilder().build(configuration);
        session = factory.openSession(true);
        accountMapper = session.getMapper(EmailAccountMapper.class);
        cursorMapper = session.getMapper(FolderCursorMapper.class);
        recordMapper = session.getMapper(MailRecordMapper.class);
        syncLogMapper = session.getMapper(SyncLogMapper.class);
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private MailRecord record(long uid, int isRead) {
        return MailRecord.builder()
                .accountId(1L)
                .providerMessageId(MailRecord.providerMessageId(1L, uid, "INBOX"))
                .uid(uid)
                .folderName("INBOX")
                .senderName("Alice")
                .senderEmail("alice@example.com")
                .recipientEmail("bob@example.com")
                .subject("hello")
                .bodyText("")
                .bodyHtml("")
                .receivedAt("2024-01-01T00:00:00Z")
                .isRead(isRead)
                .attachmentsMeta("[]")
                .build();
    }

    @Test
    @DisplayName("Cursor is created once and never moves backward")
    void testCursorMonotonicity() {
        assertThat(cursorMapper.insertIfAbsent(1L, "INBOX")).isEqualTo(1);
        assertThat(cursorMapper.insertIfAbsent(1L, "INBOX")).isZero();

        cursorMapper.advance(1L, "INBOX", 9L, 3, "2024-01-01T00:00:00Z");
        cursorMapper.advance(1L, "INBOX", 5L, 4, "2024-01-01T00:01:00Z");

        FolderCursor cursor = cursorMapper.findByAccountAndFolder(1L, "INBOX");
        assertThat(cursor.getLastUidSynced()).isEqualTo(9L);
        assertThat(cursor.getTotalServerCount()).isEqualTo(4);
        assertThat(cursor.getLastSyncAt()).isEqualTo("2024-01-01T00:01:00Z");
    }

    @Test
    @DisplayName("Advance clears the error counters recorded before it")
    void testAdvanceClearsErrors() {
        cursorMapper.insertIfAbsent(1L, "INBOX");
        cursorMapper.recordError(1L, "INBOX", "throttled", "2024-01-01T00:00:00Z");
        assertThat(cursorMapper.findByAccountAndFolder(1L, "INBOX").getSyncErrorsCount()).isEqualTo(1);

        cursorMapper.advance(1L, "INBOX", 1L, 1, "2024-01-01T00:02:00Z");

        FolderCursor cursor = cursorMapper.findByAccountAndFolder(1L, "INBOX");
        assertThat(cursor.getSyncErrorsCount()).isZero();
        assertThat(cursor.getLastErrorMessage()).isNull();
    }

    @Test
    @DisplayName("Upsert reports insertion once and keeps a single row")
    void testUpsertObservationCount() {
        UpsertOutcome first = recordMapper.upsert(record(5L, 0));
        UpsertOutcome second = recordMapper.upsert(record(5L, 1));

        assertThat(first.isInserted()).isTrue();
        assertThat(second.isInserted()).isFalse();
        assertThat(second.getId()).isEqualTo(first.getId());
        MailRecord stored = recordMapper.findByProviderMessageId(1L, "1_5_INBOX");
        assertThat(stored.getIsRead()).isEqualTo(1);
    }

    @Test
    @DisplayName("Initial sync flag flips exactly once")
    void testInitialSyncCompareAndSet() {
        EmailAccount account = EmailAccount.builder()
                .userId("user-1").email("bob@example.com").imapHost("imap.example.com").imapUsername("bob")
                .useSsl(1).active(1).syncStatus(SyncStatus.IDLE)
                .build();
        accountMapper.insert(account);
        long id = accountMapper.findActive().get(0).getId();

        assertThat(accountMapper.markInitialSyncCompleted(id, "2024-01-01T00:00:00Z")).isEqualTo(1);
        assertThat(accountMapper.markInitialSyncCompleted(id, "2024-02-01T00:00:00Z")).isZero();

        EmailAccount stored = accountMapper.findById(id);
        assertThat(stored.getInitialSyncCompleted()).isEqualTo(1);
        assertThat(stored.getWebhookEnabledAt()).isEqualTo("2024-01-01T00:00:00Z");
    }

    @Test
    @DisplayName("Success clears the reconnection flag set by a failure")
    void testAccountStatusTransitions() {
        EmailAccount account = EmailAccount.builder()
                .email("carol@example.com").imapHost("imap.example.com").imapUsername("carol").active(1)
                .build();
        accountMapper.insert(account);
        long id = accountMapper.findActive().get(0).getId();

        accountMapper.markNeedsReconnection(id, "Not authenticated", "2024-01-01T00:00:00Z");
        accountMapper.markSyncFailed(id, SyncStatus.ERROR, "reconnect", "Not authenticated", "2024-01-01T00:00:00Z");
        EmailAccount failed = accountMapper.findActiveById(id);
        assertThat(failed.getNeedsReconnection()).isEqualTo(1);
        assertThat(failed.getSyncStatus()).isEqualTo(SyncStatus.ERROR);

        accountMapper.markSyncSucceeded(id, SyncStatus.IDLE, null, "2024-01-01T00:10:00Z");
        EmailAccount recovered = accountMapper.findActiveById(id);
        assertThat(recovered.getNeedsReconnection()).isZero();
        assertThat(recovered.getLastError()).isNull();
        assertThat(recovered.getSyncStatus()).isEqualTo(SyncStatus.IDLE);
    }

    @Test
    @DisplayName("Sync log entries are appended")
    void testSyncLogInsert() throws Exception {
        syncLogMapper.insert(SyncLogEntry.builder()
                .accountId(1L).folderName("INBOX").syncType("incremental")
                .emailsFetched(3).emailsSaved(3).durationMs(120L).createdAt("2024-01-01T00:00:00Z")
                .build());
        syncLogMapper.insert(SyncLogEntry.builder()
                .accountId(1L).folderName("INBOX").syncType("incremental").createdAt("2024-01-01T00:10:00Z")
                .build());

        try (Statement statement = session.getConnection().createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*), SUM(emails_saved) FROM sync_log WHERE account_id = 1")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getInt(1)).isEqualTo(2);
            assertThat(rs.getInt(2)).isEqualTo(3);
        }
    }
}
