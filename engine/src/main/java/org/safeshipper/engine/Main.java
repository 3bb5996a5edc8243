package org.safeshipper.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.safeshipper.engine.api.dto.ValidationRequestDto;
import org.safeshipper.engine.config.EngineConfig;
import org.safeshipper.engine.domain.ValidationSystemException;
import org.safeshipper.engine.domain.model.ShipmentSnapshot;
import org.safeshipper.engine.domain.service.CompatibilityScorerImpl;
import org.safeshipper.engine.domain.service.ValidationOrchestrator;
import org.safeshipper.engine.domain.service.ValidationOrchestratorImpl;
import org.safeshipper.engine.reference.ClasspathReferenceDataSource;
import org.safeshipper.engine.reference.HttpReferenceDataSource;
import org.safeshipper.engine.reference.ReferenceDataRegistry;
import org.safeshipper.engine.reference.ReferenceDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Command line entry point of the compliance engine.
 *
 * Usage: {@code Main [request.json]}. The request is read from the given file, or from
 * standard input when no file is given, and the verdict is printed as JSON.
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run(args);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Compliance engine failed", e);
            System.exit(1);
        }
    }

    private void run(String[] args) throws IOException {
        LOG.info("=== SafeShipper Compliance Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);

        // Configure logging
        configureLogging(config);

        // Load reference data
        ReferenceDataSource source = config.isRemoteReferenceData()
                ? new HttpReferenceDataSource(config.getReferenceDataUrl())
                : new ClasspathReferenceDataSource(config.getReferenceDataResource());
        LOG.info(() -> "Loading reference data from " + source.describe());
        ReferenceDataRegistry registry = ReferenceDataRegistry.fromDto(source.load());

        ObjectMapper mapper = createObjectMapper();
        ValidationRequestDto request = readRequest(args, mapper);

        ExecutorService executor = Executors.newFixedThreadPool(config.getRankingThreads());
        try {
            ValidationOrchestrator orchestrator = new ValidationOrchestratorImpl(registry,
                    new CompatibilityScorerImpl(), Clock.systemDefaultZone(), executor, config.getExpiryWarningDays());
            Object response = dispatch(request, orchestrator);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Run the operation a request asks for.
     *
     * @throws IllegalArgumentException when the request lacks what its mode needs
     * @throws ValidationSystemException when a verdict cannot be reached
     */
    static Object dispatch(ValidationRequestDto request, ValidationOrchestrator orchestrator) {
        if (request.getMode() == null) {
            throw new IllegalArgumentException("Request has no mode");
        }
        if (request.getShipment() == null) {
            throw new IllegalArgumentException("Request has no shipment");
        }
        ShipmentSnapshot shipment = request.getShipment().toSnapshot();
        switch (request.getMode()) {
            case VEHICLE:
                requirePresent(request.getVehicle(), "vehicle");
                return orchestrator.validateVehicle(shipment, request.getVehicle().toSnapshot(), request.isStrictMode());
            case DRIVER:
                requirePresent(request.getDriver(), "driver");
                return orchestrator.validateDriver(shipment, request.getDriver().toSnapshot(), request.isStrictMode());
            case ASSIGNMENT:
                requirePresent(request.getVehicle(), "vehicle");
                requirePresent(request.getDriver(), "driver");
                return orchestrator.validateAssignment(shipment, request.getVehicle().toSnapshot(),
                        request.getDriver().toSnapshot(), request.isStrictMode());
            case RANK_VEHICLES:
                return orchestrator.rankVehicles(shipment, request.toVehicleSnapshots(), request.isIncludeWarnings());
            case RANK_DRIVERS:
                return orchestrator.rankDrivers(shipment, request.toDriverSnapshots(), request.isIncludeWarnings());
            default:
                throw new IllegalArgumentException("Unsupported mode: " + request.getMode());
        }
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        return mapper;
    }

    private static void requirePresent(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException("Request mode needs a " + name);
        }
    }

    private ValidationRequestDto readRequest(String[] args, ObjectMapper mapper) throws IOException {
        if (args.length > 0) {
            Path path = Paths.get(args[0]);
            LOG.info(() -> "Reading request from " + path.toAbsolutePath());
            return mapper.readValue(path.toFile(), ValidationRequestDto.class);
        }
        LOG.info("Reading request from standard input");
        InputStream in = System.in;
        return mapper.readValue(in, ValidationRequestDto.class);
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        String logFilePath = config.getLogFilePath();
        Path target = Paths.get(logFilePath).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
