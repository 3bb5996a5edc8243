package org.safeshipper.engine.reference;

import org.safeshipper.engine.api.dto.ReferenceDataDto;

/**
 * Supplier of the reference data document loaded at startup.
 */
public interface ReferenceDataSource {

    /**
     * Load the reference data document.
     *
     * @throws ReferenceDataException if the document cannot be read or parsed
     */
    ReferenceDataDto load();

    /**
     * Human readable origin, used in log messages.
     */
    String describe();
}
