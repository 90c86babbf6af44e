package com.my.bridge.support;

import com.my.bridge.adapter.out.persistence.SqliteSchemaInitializer;
import com.my.bridge.config.PersistenceConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;

public final class TestDatabase {

    private TestDatabase() {
    }

    public static SQLiteDataSource create(Path dir) {
        SQLiteDataSource dataSource = PersistenceConfig.sqlite(dir.resolve("bridge.db"), 5000);
        new SqliteSchemaInitializer(dataSource).init();
        return dataSource;
    }
}
