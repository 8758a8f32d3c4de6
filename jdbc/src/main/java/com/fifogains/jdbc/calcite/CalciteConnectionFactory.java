package com.fifogains.jdbc.calcite;

import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderResult;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Helper for opening Calcite connections that are pre-wired with the FIFO schema.
 */
public final class CalciteConnectionFactory {

    public static final String SCHEMA_NAME = "fifo";

    private CalciteConnectionFactory() {}

    /**
     * Opens a connection whose default schema serves an already computed result.
     *
     * @param properties Calcite connection properties; FIFO option keys are ignored here
     */
    public static Connection connect(
            Path sourcePath, FifoOptions options, LoaderResult loaderResult, Properties properties)
            throws SQLException {
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(loaderResult, "loaderResult");
        Properties calciteProps = new Properties();
        if (properties != null) {
            calciteProps.putAll(properties);
        }
        for (String key : FifoOptions.PROPERTY_KEYS) {
            calciteProps.remove(key);
        }
        setDefault(calciteProps, "lex", "JAVA");
        setDefault(calciteProps, "quoting", "DOUBLE_QUOTE");
        setDefault(calciteProps, "quotedCasing", "UNCHANGED");
        setDefault(calciteProps, "unquotedCasing", "UNCHANGED");
        setDefault(calciteProps, "caseSensitive", "true");

        Connection connection = DriverManager.getConnection("jdbc:calcite:", calciteProps);
        CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
        SchemaPlus root = calcite.getRootSchema();
        root.add(
                SCHEMA_NAME,
                new FifoSchema(root, SCHEMA_NAME, sourcePath.toAbsolutePath(), options, loaderResult));
        calcite.setSchema(SCHEMA_NAME);
        return connection;
    }

    private static void setDefault(Properties properties, String key, String value) {
        if (!properties.containsKey(key)) {
            properties.setProperty(key, value);
        }
    }
}
