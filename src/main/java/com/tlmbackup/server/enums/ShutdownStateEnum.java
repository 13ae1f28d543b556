package com.tlmbackup.server.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;

import java.util.Map;
import java.util.Set;

@AllArgsConstructor
@Getter
public enum ShutdownStateEnum {

    RUNNING("RUNNING"),

    SHUTDOWN_REQUESTED("SHUTDOWN_REQUESTED"),

    STOPPED("STOPPED"),

    FORCE_STOPPED("FORCE_STOPPED"),
    ;

    private final String name;

    // STOPPED 和 FORCE_STOPPED 是终态
    private static final Map<ShutdownStateEnum, Set<ShutdownStateEnum>> VALID_TRANSITIONS = Map.of(
            RUNNING, Set.of(SHUTDOWN_REQUESTED),
            SHUTDOWN_REQUESTED, Set.of(STOPPED, FORCE_STOPPED)
    );

    public static boolean isTransitionProhibit(ShutdownStateEnum from, ShutdownStateEnum to) {
        if (ObjectUtils.anyNull(from, to)) {
            return true;
        }
        Set<ShutdownStateEnum> validNextState = VALID_TRANSITIONS.get(from);
        if (CollectionUtils.isEmpty(validNextState)) {
            return true;
        }
        return !validNextState.contains(to);
    }

    public boolean isTerminal() {
        return this == STOPPED || this == FORCE_STOPPED;
    }
}
