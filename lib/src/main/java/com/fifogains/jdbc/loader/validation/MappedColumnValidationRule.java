package com.fifogains.jdbc.loader.validation;

import com.fifogains.jdbc.loader.ErrorKind;
import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderMessage;
import com.fifogains.jdbc.loader.RawTable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Every mandatory field must be mapped (a configuration problem) and every mapped column must exist
 * in the header (a schema problem).
 */
final class MappedColumnValidationRule implements ValidationRule {

    @Override
    public List<LoaderMessage> validate(RawTable table, FifoOptions options) {
        List<LoaderMessage> messages = new ArrayList<>();
        for (Map.Entry<String, String> field : options.getColumns().requiredFields().entrySet()) {
            if (field.getValue() == null) {
                messages.add(
                        LoaderMessage.error(ErrorKind.CONFIG, "No column mapped for " + field.getKey()));
            }
        }
        if (!messages.isEmpty()) {
            return messages;
        }
        Set<String> header = new HashSet<>(table.getHeader());
        for (String column : options.requiredColumns()) {
            if (!header.contains(column)) {
                messages.add(
                        LoaderMessage.error(ErrorKind.SCHEMA, "Mapped column not found in source: " + column));
            }
        }
        return messages;
    }
}
