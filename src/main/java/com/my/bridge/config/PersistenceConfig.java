package com.my.bridge.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 왜: 저장소 어댑터와 멱등성 저장소가 같은 SQLite 파일을 같은 PRAGMA(WAL, 외래 키, busy timeout)로 열도록 하기 위함.
 */
@ApplicationScoped
public class PersistenceConfig {

    private static final Logger log = Logger.getLogger(PersistenceConfig.class);

    @Produces
    @Singleton
    public DataSource dataSource(AppConfig appConfig) {
        Path path = Path.of(appConfig.database().path()).toAbsolutePath();
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("SQLite 경로 생성 실패: " + path, e);
        }
        log.infof("SQLite 데이터베이스: %s", path);
        return sqlite(path, appConfig.database().busyTimeoutMs());
    }

    public static SQLiteDataSource sqlite(Path path, int busyTimeoutMs) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.enforceForeignKeys(true);
        config.setBusyTimeout(busyTimeoutMs);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + path);
        return dataSource;
    }
}
