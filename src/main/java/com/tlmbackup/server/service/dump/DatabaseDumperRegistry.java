package com.tlmbackup.server.service.dump;

import com.tlmbackup.server.enums.DatabaseEngineEnum;
import com.tlmbackup.server.exception.DumpException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class DatabaseDumperRegistry {

    private final List<DatabaseDumper> databaseDumpers;

    @Autowired
    public DatabaseDumperRegistry(List<DatabaseDumper> databaseDumpers) {
        this.databaseDumpers = databaseDumpers;
    }

    // 每次查找, 不在构造时缓存 engine
    public DatabaseDumper getDumper(DatabaseEngineEnum engine) throws DumpException {
        for (DatabaseDumper databaseDumper : this.databaseDumpers) {
            if (databaseDumper.getEngine() == engine) {
                return databaseDumper;
            }
        }
        throw new DumpException("getDumper failed. no dumper registered for engine %s".formatted(engine));
    }
}
