package com.iplicense.search.adapter;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;

/**
 * Binds positional arguments and caps the statement with a JDBC query timeout. JDBC timeouts are whole
 * seconds, so any positive budget rounds up to at least one second.
 */
final class TimedStatementSetter extends ArgumentPreparedStatementSetter {
    private final Object[] args;
    private final int timeoutSeconds;

    TimedStatementSetter(Object[] args, Duration timeout) {
        super(args);
        this.args = args == null ? new Object[0] : args.clone();
        this.timeoutSeconds = toSeconds(timeout);
    }

    @Override
    public void setValues(PreparedStatement ps) throws SQLException {
        ps.setQueryTimeout(timeoutSeconds);
        super.setValues(ps);
    }

    Object[] args() {
        return args.clone();
    }

    int timeoutSeconds() {
        return timeoutSeconds;
    }

    static int toSeconds(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return 1;
        }
        long millis = timeout.toMillis();
        long seconds = (millis + 999L) / 1000L;
        return (int) Math.max(1L, Math.min(Integer.MAX_VALUE, seconds));
    }
}
