package com.tlmbackup.server.model.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class JobSpec {

    private String name;

    // DatabaseTarget name
    private String target;

    private List<String> databases = new ArrayList<>();

    private Schedule schedule = Schedule.disabled();

    public JobSpec(String name, String target, List<String> databases, Schedule schedule) {
        this.name = name;
        this.target = target;
        this.databases = new ArrayList<>(databases);
        this.schedule = schedule;
    }

    // 未配置 name 时, 使用 <target>:<db1,db2,...> 作为稳定的 job 标识
    public String getName() {
        if (StringUtils.isNotBlank(this.name)) {
            return this.name;
        }
        return "%s:%s".formatted(this.target, String.join(",", this.databases));
    }
}
