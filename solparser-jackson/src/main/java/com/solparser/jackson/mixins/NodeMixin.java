package com.solparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Mixed into every node interface so that nodes are written with their record
 * name under {@code nodeType} and read back into the same record.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "nodeType")
public interface NodeMixin {
}
