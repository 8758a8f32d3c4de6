package com.fifogains.jdbc.tools;

import com.fifogains.jdbc.export.CsvResultExporter;
import com.fifogains.jdbc.loader.FifoLoader;
import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderException;
import com.fifogains.jdbc.loader.LoaderResult;
import com.fifogains.jdbc.loader.SkippedRow;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.util.Properties;

/**
 * Command-line front end: computes realized gains for a CSV export and either writes the result
 * rows as CSV or runs a SQL query against the computed tables.
 */
public final class FifoGainsCli {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private static final String USAGE =
            "Usage: FifoGainsCli <transactions.csv> <options.properties> [<out.csv> | --sql <query>]";

    private FifoGainsCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean sqlMode = args.length == 4 && "--sql".equals(args[2]);
        boolean exportMode = args.length == 2 || (args.length == 3 && !args[2].startsWith("--"));
        if (!sqlMode && !exportMode) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path source = Path.of(args[0]).toAbsolutePath().normalize();
        Properties properties;
        try {
            properties = readProperties(Path.of(args[1]));
        } catch (IOException ex) {
            err.println("Cannot read options file " + args[1] + ": " + ex.getMessage());
            return EXIT_FAILURE;
        }
        try {
            if (sqlMode) {
                runQuery(source, properties, args[3], out, err);
            } else {
                export(source, properties, args.length == 3 ? Path.of(args[2]) : null, out, err);
            }
            return EXIT_OK;
        } catch (LoaderException | SQLException | IOException ex) {
            err.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void export(
            Path source, Properties properties, Path target, PrintStream out, PrintStream err)
            throws LoaderException, IOException {
        FifoOptions options = FifoOptions.fromProperties(properties);
        LoaderResult result = new FifoLoader().load(source, options);
        for (SkippedRow skipped : result.getSkippedRows()) {
            err.println(
                    "Skipped row " + skipped.getRowNumber() + " (" + skipped.getReason() + "): " + skipped.getDetail());
        }
        CsvResultExporter exporter = new CsvResultExporter();
        if (target == null) {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            exporter.write(result.getLedgerData().getResultRows(), options, writer);
        } else {
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                exporter.write(result.getLedgerData().getResultRows(), options, writer);
            }
            err.println("Wrote " + result.getLedgerData().getResultRows().size() + " rows to " + target);
        }
    }

    private static void runQuery(
            Path source, Properties properties, String sql, PrintStream out, PrintStream err)
            throws SQLException {
        try (Connection connection =
                        DriverManager.getConnection("jdbc:fifo:" + source.toUri(), properties);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(sql)) {
            for (SQLWarning warning = connection.getWarnings();
                    warning != null;
                    warning = warning.getNextWarning()) {
                err.println(warning.getMessage());
            }
            int columns = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                StringBuilder builder = new StringBuilder();
                for (int i = 1; i <= columns; i++) {
                    if (i > 1) {
                        builder.append(" | ");
                    }
                    builder.append(rs.getMetaData().getColumnLabel(i)).append("=").append(rs.getObject(i));
                }
                out.println(builder);
            }
        }
    }

    private static Properties readProperties(Path path) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return properties;
    }
}
