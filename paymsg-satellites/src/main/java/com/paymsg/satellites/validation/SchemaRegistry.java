package com.paymsg.satellites.validation;

import com.paymsg.config.TranscoderSettingsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps ISO 20022 namespaces to the XSD files that declare them.
 *
 * <p>The process-wide instance is built on first use by scanning the configured
 * schema directory and is read-only afterwards. Each XSD is identified by a
 * partial read of its {@code targetNamespace} attribute; the schema itself is
 * only parsed when a document is validated against it. A missing directory
 * yields an empty registry.</p>
 */
public final class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private static final Pattern TARGET_NAMESPACE = Pattern.compile("targetNamespace\\s*=\\s*[\"']([^\"']+)[\"']");
    private static final int HEADER_BYTES = 8192;
    private static final String SCHEMA_SUFFIX = ".xsd";

    private static final Object LOCK = new Object();
    private static volatile SchemaRegistry instance;

    private final Map<String, Path> schemas;

    private SchemaRegistry(Map<String, Path> schemas) {
        this.schemas = Collections.unmodifiableMap(schemas);
    }

    /**
     * The shared registry, scanning the configured schema directory on first call.
     */
    public static SchemaRegistry getInstance() {
        SchemaRegistry registry = instance;
        if (registry == null) {
            synchronized (LOCK) {
                registry = instance;
                if (registry == null) {
                    String directory = TranscoderSettingsLoader.defaults().effectiveSchemaDirectory();
                    registry = scan(resolveDirectory(directory));
                    log.info("Schema registry initialised from '{}' with {} namespace(s)", directory, registry.size());
                    instance = registry;
                }
            }
        }
        return registry;
    }

    /**
     * Builds a registry from every {@code .xsd} below {@code directory}. The first
     * file found for a namespace wins; files are visited in path order.
     */
    public static SchemaRegistry scan(Path directory) {
        Map<String, Path> schemas = new LinkedHashMap<>();
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Schema directory {} not found, schema registry is empty", directory);
            return new SchemaRegistry(schemas);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(SCHEMA_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to scan schema directory {}, schema registry is empty", directory, e);
            return new SchemaRegistry(schemas);
        }

        for (Path file : files) {
            String namespace = targetNamespace(file);
            if (namespace == null) {
                log.debug("No targetNamespace declared in {}", file);
                continue;
            }
            Path previous = schemas.putIfAbsent(namespace, file);
            if (previous != null) {
                log.debug("Namespace {} already registered by {}, ignoring {}", namespace, previous, file);
            }
        }
        return new SchemaRegistry(schemas);
    }

    public Optional<Path> lookup(String namespace) {
        return namespace == null ? Optional.empty() : Optional.ofNullable(schemas.get(namespace));
    }

    public boolean contains(String namespace) {
        return namespace != null && schemas.containsKey(namespace);
    }

    public Set<String> namespaces() {
        return schemas.keySet();
    }

    public int size() {
        return schemas.size();
    }

    /**
     * Filesystem path first, then a directory on the classpath.
     */
    static Path resolveDirectory(String directory) {
        if (directory == null || directory.trim().isEmpty()) {
            return null;
        }
        Path path = Paths.get(directory.trim());
        if (Files.isDirectory(path)) {
            return path;
        }
        String resource = directory.trim().startsWith("/") ? directory.trim() : "/" + directory.trim();
        URL url = SchemaRegistry.class.getResource(resource);
        if (url == null) {
            return path;
        }
        if (!"file".equals(url.getProtocol())) {
            log.warn("Schema directory {} is packaged as {}, only exploded directories can be scanned", directory, url);
            return path;
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            log.warn("Cannot resolve schema directory {} from {}", directory, url, e);
            return path;
        }
    }

    private static String targetNamespace(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            byte[] header = in.readNBytes(HEADER_BYTES);
            Matcher matcher = TARGET_NAMESPACE.matcher(new String(header, StandardCharsets.UTF_8));
            return matcher.find() ? matcher.group(1) : null;
        } catch (IOException e) {
            log.warn("Failed to read schema file {}", file, e);
            return null;
        }
    }
}
