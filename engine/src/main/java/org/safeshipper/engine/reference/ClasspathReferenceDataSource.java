package org.safeshipper.engine.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.safeshipper.engine.api.dto.ReferenceDataDto;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads the reference data document bundled on the classpath.
 */
public final class ClasspathReferenceDataSource implements ReferenceDataSource {

    private static final Logger LOG = Logger.getLogger(ClasspathReferenceDataSource.class.getName());

    public static final String DEFAULT_RESOURCE = "reference-data.json";

    private final String resource;
    private final ObjectMapper mapper;

    public ClasspathReferenceDataSource() {
        this(DEFAULT_RESOURCE);
    }

    public ClasspathReferenceDataSource(String resource) {
        this(resource, new ObjectMapper());
    }

    public ClasspathReferenceDataSource(String resource, ObjectMapper mapper) {
        this.resource = Objects.requireNonNull(resource, "resource must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public ReferenceDataDto load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ClasspathReferenceDataSource.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ReferenceDataException("Reference data resource not found: " + resource);
            }
            ReferenceDataDto data = mapper.readValue(in, ReferenceDataDto.class);
            LOG.fine(() -> "Read reference data from classpath:" + resource);
            return data;
        } catch (IOException e) {
            throw new ReferenceDataException("Failed to read reference data resource " + resource, e);
        }
    }

    @Override
    public String describe() {
        return "classpath:" + resource;
    }
}
