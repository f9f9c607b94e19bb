package dk.cloudcreate.eventsourcing.eventstore.jdbi;

import org.jdbi.v3.core.statement.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Logs the SQL executed by the {@link JdbiEventStoreEntityPersistence} on the <code>EventStore.Sql</code> logger:
 * execution time and rendered SQL at trace level, failed statements at error level
 */
public class EventStoreSqlLogger implements SqlLogger {
    private final Logger log;

    public EventStoreSqlLogger() {
        log = LoggerFactory.getLogger("EventStore.Sql");
    }

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("Execution time: {} ms - {}", elapsedMillis(context, context.getCompletionMoment()), context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        log.error(msg("Failed Execution time: {} ms - {}", elapsedMillis(context, context.getExceptionMoment()), context.getRenderedSql()), ex);
    }

    private static long elapsedMillis(StatementContext context, Instant endMoment) {
        if (context.getExecutionMoment() == null || endMoment == null) {
            return -1;
        }
        return Duration.between(context.getExecutionMoment(), endMoment).toMillis();
    }
}
