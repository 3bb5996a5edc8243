package org.safeshipper.engine.domain.model;

public enum ValidationType {
    DANGEROUS_GOODS,
    NON_DANGEROUS_GOODS
}
