package com.minutebars.db;

import org.apache.logging.log4j.Logger;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.Locale;
import java.util.Set;

/**
 * Wraps a JDBC connection so statements and transaction boundaries are written to the SQL logger.
 */
final class SqlLogProxy {
    private static final Set<String> EXECUTE_METHODS = Set.of(
            "execute", "executeQuery", "executeUpdate", "executeLargeUpdate", "executeBatch", "executeLargeBatch");
    private static final Set<String> TRANSACTION_METHODS = Set.of(
            "commit", "rollback", "setSavepoint", "releaseSavepoint", "setAutoCommit");
    private static final int MAX_SQL_CHARS = 600;

    private SqlLogProxy() {
    }

    static Connection wrapConnection(Connection delegate, Logger logger) {
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class[]{Connection.class},
                new ConnectionHandler(delegate, logger)
        );
    }

    private static Object invoke(Object target, Method method, Object[] args) throws Throwable {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getTargetException();
        }
    }

    private static String normalizeSql(String sql) {
        if (sql == null) {
            return "";
        }
        String normalized = sql.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= MAX_SQL_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_SQL_CHARS) + "...";
    }

    private static String elapsedMs(long started) {
        return String.format(Locale.US, "%.3f", (System.nanoTime() - started) / 1_000_000.0);
    }

    private static final class ConnectionHandler implements InvocationHandler {
        private final Connection delegate;
        private final Logger logger;

        private ConnectionHandler(Connection delegate, Logger logger) {
            this.delegate = delegate;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if (TRANSACTION_METHODS.contains(name)) {
                try {
                    Object out = SqlLogProxy.invoke(delegate, method, args);
                    logger.debug("TX {}{}", name, args != null && args.length == 1 && args[0] instanceof Boolean
                            ? " " + args[0] : "");
                    return out;
                } catch (Throwable t) {
                    logger.warn("TX {} failed: {}", name, t.getMessage());
                    throw t;
                }
            }
            Object out = SqlLogProxy.invoke(delegate, method, args);
            if ("prepareStatement".equals(name) && out instanceof PreparedStatement
                    && args != null && args.length > 0 && args[0] instanceof String) {
                return wrap(PreparedStatement.class, out, (String) args[0]);
            }
            if ("createStatement".equals(name) && out instanceof Statement) {
                return wrap(Statement.class, out, null);
            }
            return out;
        }

        private Object wrap(Class<?> type, Object statement, String preparedSql) {
            return Proxy.newProxyInstance(
                    type.getClassLoader(),
                    new Class[]{type},
                    new StatementHandler(statement, preparedSql, logger)
            );
        }
    }

    private static final class StatementHandler implements InvocationHandler {
        private final Object delegate;
        private final String preparedSql;
        private final Logger logger;

        private StatementHandler(Object delegate, String preparedSql, Logger logger) {
            this.delegate = delegate;
            this.preparedSql = preparedSql;
            this.logger = logger;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String name = method.getName();
            if (!EXECUTE_METHODS.contains(name)) {
                return SqlLogProxy.invoke(delegate, method, args);
            }
            String sql = preparedSql;
            if (sql == null && args != null && args.length > 0 && args[0] instanceof String) {
                sql = (String) args[0];
            }
            long started = System.nanoTime();
            try {
                Object out = SqlLogProxy.invoke(delegate, method, args);
                if (logger.isInfoEnabled()) {
                    logger.info("SQL ok method={} elapsed_ms={}{} sql={}",
                            name, elapsedMs(started), out instanceof Number ? " rows=" + out : "", normalizeSql(sql));
                }
                return out;
            } catch (Throwable t) {
                logger.warn("SQL fail method={} elapsed_ms={} err={} sql={}",
                        name, elapsedMs(started), t.getMessage(), normalizeSql(sql));
                throw t;
            }
        }
    }
}
