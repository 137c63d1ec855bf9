package com.sarkariexams.backend.global.security;

import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One line per security event on the {@code security} logger, as {@code event=<name> k=v ...}.
 * Denials go out at WARN, everything else at INFO.
 */
@Component
public class SecurityEventLogger {

    private static final Logger log = LoggerFactory.getLogger("security");

    public void info(String event, Map<String, ?> fields) {
        if (log.isInfoEnabled()) {
            log.info(format(event, fields));
        }
    }

    public void warn(String event, Map<String, ?> fields) {
        log.warn(format(event, fields));
    }

    private static String format(String event, Map<String, ?> fields) {
        StringJoiner line = new StringJoiner(" ");
        line.add("security_event event=" + event);
        if (fields != null) {
            new TreeMap<>(fields).forEach((key, value) -> {
                if (value != null) {
                    line.add(key + "=" + value);
                }
            });
        }
        return line.toString();
    }
}
