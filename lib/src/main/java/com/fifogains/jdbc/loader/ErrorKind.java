package com.fifogains.jdbc.loader;

/** Categories of problems found while loading transactions. */
public enum ErrorKind {
    /** The source table is too narrow, empty, or lacks a mapped column. Fatal. */
    SCHEMA,
    /** Missing buy/sell values or column mappings. Fatal. */
    CONFIG,
    /** A mapped column is blank on a row; the row is dropped. */
    MISSING_VALUE,
    /** Quantity or price is not a number; the row is dropped. */
    ROW_PARSE,
    /** The date could not be parsed; the row is kept with an invalid date. */
    DATE_PARSE,
    /** The type value is neither a buy nor a sell value; the row is ignored. */
    UNRECOGNIZED_TYPE,
    /** The source file could not be read. Fatal. */
    FILE_LOAD
}
