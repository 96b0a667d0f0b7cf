package org.learningjava.pyml.domain.model.tree;

public enum Role {
    UNCLASSIFIED,
    ASSIGNMENT,
    BARE_CALL,
    ARG_CALL,
    IF_HEADER,
    ELSE_HEADER,
    FOR_HEADER,
    RANGE_FOR_HEADER,
    FUNCTION_DEF,
    RETURN,
    PRINT,
    IMPORT_LIST,
    IMPORT_ENTRY,
    LIST_ENTRY,
    DICT_ENTRY,
    COMMENT
}
