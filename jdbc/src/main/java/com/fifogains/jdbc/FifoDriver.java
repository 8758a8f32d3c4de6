package com.fifogains.jdbc;

import com.fifogains.jdbc.calcite.CalciteConnectionFactory;
import com.fifogains.jdbc.loader.FifoLoader;
import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderException;
import com.fifogains.jdbc.loader.LoaderMessage;
import com.fifogains.jdbc.loader.LoaderResult;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC driver that computes FIFO realized gains for a transaction file and serves the result
 * through a Calcite connection.
 *
 * <p>URL form: {@code jdbc:fifo:<path or file URI>?buy=BUY&sell=SELL&dateColumn=Date&...}. URL
 * parameters take precedence over connection properties with the same key.
 */
public final class FifoDriver implements Driver {

    static final String URL_PREFIX = "jdbc:fifo:";
    private static final Logger LOGGER = Logger.getLogger(FifoDriver.class.getName());
    private static final Set<String> REQUIRED_PROPERTIES =
            Set.of(
                    FifoOptions.DATE_COLUMN,
                    FifoOptions.TYPE_COLUMN,
                    FifoOptions.QUANTITY_COLUMN,
                    FifoOptions.PRICE_COLUMN,
                    FifoOptions.IDENTIFIER_COLUMN,
                    FifoOptions.BUY_VALUES,
                    FifoOptions.SELL_VALUES);

    static {
        try {
            DriverManager.registerDriver(new FifoDriver());
        } catch (SQLException ex) {
            throw new ExceptionInInitializerError(ex);
        }
    }

    @Override
    public Connection connect(String url, Properties info) throws SQLException {
        if (!acceptsURL(url)) {
            return null;
        }
        ParsedUrl parsed = parseUrl(url);
        Properties properties = new Properties();
        if (info != null) {
            properties.putAll(info);
        }
        properties.putAll(parsed.properties);
        FifoOptions options = FifoOptions.fromProperties(properties);
        LoaderResult loaderResult;
        try {
            loaderResult = new FifoLoader().load(parsed.sourcePath, options);
        } catch (LoaderException ex) {
            throw new SQLException(
                    "Failed to load transactions: " + parsed.sourcePath + ": " + ex.getMessage(), ex);
        }
        Connection connection =
                CalciteConnectionFactory.connect(parsed.sourcePath, options, loaderResult, properties);
        SQLWarning warnings = buildWarningChain(loaderResult, parsed.sourcePath);
        logWarnings(loaderResult, parsed.sourcePath);
        return wrapCalciteConnection(connection, warnings);
    }

    @Override
    public boolean acceptsURL(String url) {
        return url != null && url.startsWith(URL_PREFIX);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
        List<String> keys = FifoOptions.PROPERTY_KEYS;
        DriverPropertyInfo[] result = new DriverPropertyInfo[keys.size()];
        for (int i = 0; i < keys.size(); i++) {
            String key = keys.get(i);
            DriverPropertyInfo property =
                    new DriverPropertyInfo(key, info == null ? null : info.getProperty(key));
            property.required = REQUIRED_PROPERTIES.contains(key);
            result[i] = property;
        }
        return result;
    }

    @Override
    public int getMajorVersion() {
        return Version.MAJOR;
    }

    @Override
    public int getMinorVersion() {
        return Version.MINOR;
    }

    @Override
    public boolean jdbcCompliant() {
        return false;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("Logging hierarchy not implemented.");
    }

    static ParsedUrl parseUrl(String url) throws SQLException {
        String remainder = url.substring(URL_PREFIX.length());
        if (remainder.isEmpty()) {
            throw new SQLException("Transaction file path missing from JDBC URL.");
        }

        String sourceSegment = remainder;
        Properties props = new Properties();
        int paramIndex = remainder.indexOf('?');
        if (paramIndex >= 0) {
            sourceSegment = remainder.substring(0, paramIndex);
            String query = remainder.substring(paramIndex + 1);
            for (String pair : query.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key;
                String value;
                if (eq >= 0) {
                    key = pair.substring(0, eq);
                    value = pair.substring(eq + 1);
                } else {
                    key = pair;
                    value = "";
                }
                props.setProperty(decode(key), decode(value));
            }
        }

        Path sourcePath;
        if (sourceSegment.startsWith("file:")) {
            try {
                sourcePath = Paths.get(java.net.URI.create(sourceSegment));
            } catch (IllegalArgumentException ex) {
                throw new SQLException("Invalid file URI in JDBC URL: " + sourceSegment, ex);
            }
        } else {
            sourcePath = Paths.get(sourceSegment);
        }

        sourcePath = sourcePath.normalize();

        if (!Files.exists(sourcePath)) {
            throw new SQLException("Transaction file not found: " + sourcePath);
        }
        if (!Files.isReadable(sourcePath)) {
            throw new SQLException("Transaction file is not readable: " + sourcePath);
        }

        return new ParsedUrl(sourcePath.toAbsolutePath(), props);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private Connection wrapCalciteConnection(Connection delegate, SQLWarning warnings) {
        return (Connection)
                Proxy.newProxyInstance(
                        Connection.class.getClassLoader(),
                        new Class<?>[] {Connection.class},
                        new DelegatingHandler(delegate) {
                            private SQLWarning localWarnings = warnings;

                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                if ("getMetaData".equals(method.getName()) && args == null) {
                                    DatabaseMetaData meta = (DatabaseMetaData) method.invoke(delegate);
                                    return wrapCalciteMetaData(meta);
                                } else if ("getWarnings".equals(method.getName())) {
                                    return localWarnings;
                                } else if ("clearWarnings".equals(method.getName())) {
                                    localWarnings = null;
                                    return null;
                                }
                                return super.handle(proxy, method, args);
                            }
                        });
    }

    private SQLWarning buildWarningChain(LoaderResult loaderResult, Path sourcePath) {
        SQLWarning head = null;
        SQLWarning tail = null;
        for (LoaderMessage message : loaderResult.getMessages()) {
            if (message.getLevel() != LoaderMessage.Level.WARNING) {
                continue;
            }
            SQLWarning warning =
                    new SQLWarning(
                            "[FIFO JDBC] " + describe(message) + " (" + sourcePath.getFileName() + ")");
            if (head == null) {
                head = warning;
                tail = warning;
            } else {
                tail.setNextWarning(warning);
                tail = warning;
            }
        }
        return head;
    }

    private void logWarnings(LoaderResult loaderResult, Path sourcePath) {
        for (LoaderMessage message : loaderResult.getMessages()) {
            if (message.getLevel() != LoaderMessage.Level.WARNING) {
                continue;
            }
            LOGGER.log(
                    Level.WARNING,
                    "[FIFO JDBC] {0} ({1})",
                    new Object[] {describe(message), sourcePath.getFileName()});
        }
    }

    private static String describe(LoaderMessage message) {
        if (message.getRowNumber() > 0) {
            return message.getMessage() + " at row " + message.getRowNumber();
        }
        return message.getMessage();
    }

    private DatabaseMetaData wrapCalciteMetaData(DatabaseMetaData delegate) {
        return (DatabaseMetaData)
                Proxy.newProxyInstance(
                        DatabaseMetaData.class.getClassLoader(),
                        new Class<?>[] {DatabaseMetaData.class},
                        new DelegatingHandler(delegate) {
                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getDatabaseProductName" -> "FIFO Gains";
                                    case "getDatabaseProductVersion", "getDriverVersion" -> Version.RUNTIME;
                                    case "getDriverName" -> "FIFO Gains JDBC Driver (Calcite)";
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    record ParsedUrl(Path sourcePath, Properties properties) {}

    private abstract static class DelegatingHandler implements InvocationHandler {
        private final Object delegate;

        DelegatingHandler(Object delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            try {
                if (method.getDeclaringClass() == Object.class) {
                    return method.invoke(delegate, args);
                }
                return handle(proxy, method, args);
            } catch (InvocationTargetException ex) {
                throw ex.getCause();
            }
        }

        Object handle(Object proxy, Method method, Object[] args) throws Throwable {
            return method.invoke(delegate, args);
        }
    }
}
