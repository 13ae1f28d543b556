package com.tlmbackup.server.model.config;

import com.tlmbackup.server.enums.DatabaseEngineEnum;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.apache.commons.lang3.ObjectUtils;

@Data
@NoArgsConstructor
public class DatabaseTarget {

    private String name;

    private DatabaseEngineEnum engine = DatabaseEngineEnum.MYSQL;

    private String host = "localhost";

    private Integer port;

    private String username;

    @ToString.Exclude
    private String password;

    public int getPortOrDefault() {
        return ObjectUtils.isEmpty(this.port) ? this.engine.getDefaultPort() : this.port;
    }
}
