package com.fifogains.jdbc.loader.validation;

import com.fifogains.jdbc.loader.FifoOptions;
import com.fifogains.jdbc.loader.LoaderMessage;
import com.fifogains.jdbc.loader.RawTable;
import java.util.List;

/**
 * A single pre-computation check over the source table and the options. Rules are deterministic
 * and report problems in the order they discover them; {@code ERROR} messages abort the run.
 */
public interface ValidationRule {

    /**
     * Evaluate this rule.
     *
     * @param table Source table as read, before normalization.
     * @param options Run configuration.
     * @return A list of diagnostics, possibly empty. Implementations must not return null.
     */
    List<LoaderMessage> validate(RawTable table, FifoOptions options);
}
