package org.jrename;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/** One line per record: time, level, source method and message. */
class LogFormat extends Formatter {
    private static final DateTimeFormatter TIME =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    @Override
    public String format(LogRecord record) {
        var source = record.getLoggerName();
        if (record.getSourceClassName() != null) {
            var className = record.getSourceClassName();
            source = className.substring(className.lastIndexOf('.') + 1) + "." + record.getSourceMethodName();
        }
        var line =
                String.format(
                        "%s %s %s %s%n",
                        TIME.format(Instant.ofEpochMilli(record.getMillis())),
                        record.getLevel().getName(),
                        source,
                        formatMessage(record));
        if (record.getThrown() == null) return line;
        var trace = new StringWriter();
        record.getThrown().printStackTrace(new PrintWriter(trace));
        return line + trace;
    }
}
