package com.fifogains.jdbc.calcite;

import com.fifogains.jdbc.loader.FifoOptions;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Calcite {@link SchemaFactory} entry point for inline models. The operand names the source with
 * {@value #FILE_OPERAND} and takes the same option keys as the JDBC URL; list-valued options may
 * be given either as JSON arrays or as comma-separated strings.
 */
public final class FifoSchemaFactory implements SchemaFactory {

    static final String FILE_OPERAND = "file";

    @Override
    public Schema create(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        Objects.requireNonNull(parentSchema, "parentSchema");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operand, "operand");
        return new FifoSchema(parentSchema, name, resolveSourcePath(operand), toOptions(operand));
    }

    static Path resolveSourcePath(Map<String, Object> operand) {
        Object file = operand.get(FILE_OPERAND);
        if (file == null) {
            throw new IllegalArgumentException("FIFO schema operand must include '" + FILE_OPERAND + "'");
        }
        return Paths.get(file.toString()).toAbsolutePath().normalize();
    }

    static FifoOptions toOptions(Map<String, Object> operand) {
        Properties properties = new Properties();
        for (String key : FifoOptions.PROPERTY_KEYS) {
            Object value = operand.get(key);
            if (value instanceof Collection<?> values) {
                StringBuilder joined = new StringBuilder();
                for (Object item : values) {
                    if (joined.length() > 0) {
                        joined.append(',');
                    }
                    joined.append(item);
                }
                properties.setProperty(key, joined.toString());
            } else if (value != null) {
                properties.setProperty(key, value.toString());
            }
        }
        return FifoOptions.fromProperties(properties);
    }
}
