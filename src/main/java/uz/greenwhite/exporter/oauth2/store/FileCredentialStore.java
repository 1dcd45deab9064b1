package uz.greenwhite.exporter.oauth2.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import uz.greenwhite.exporter.metrics.ExporterMetrics;
import uz.greenwhite.exporter.oauth2.exception.CredentialStoreException;
import uz.greenwhite.exporter.oauth2.exception.OAuth2ErrorType;
import uz.greenwhite.exporter.oauth2.model.Credential;
import uz.greenwhite.exporter.oauth2.model.TokenResponse;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * JSON file holding {@code access_token}, {@code refresh_token}, {@code expires_at} (epoch seconds)
 * and {@code scope}. Writes go to a sibling temp file that is renamed over the target.
 */
@Slf4j
public class FileCredentialStore implements CredentialStore {

    private static final String TEMP_SUFFIX = ".tmp";
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
    private static final boolean POSIX = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");

    private final Path stateFile;
    private final ObjectMapper objectMapper;
    private final ExporterMetrics metrics;

    public FileCredentialStore(Path stateFile, ObjectMapper objectMapper, ExporterMetrics metrics) {
        this.stateFile = stateFile.toAbsolutePath();
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.metrics = metrics;
    }

    public Path getStateFile() {
        return stateFile;
    }

    @Override
    public Optional<Credential> load() {
        if (!Files.exists(stateFile)) {
            log.info("No persisted credential at {}", stateFile);
            return Optional.empty();
        }
        try {
            String json = Files.readString(stateFile, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                log.info("Persisted credential file {} is empty", stateFile);
                return Optional.empty();
            }
            Credential credential = parse(objectMapper.readTree(json));
            log.info("Persisted credential loaded from {}: {}", stateFile, credential);
            return Optional.of(credential);
        } catch (Exception e) {
            log.warn("[{}] Ignoring unreadable credential file {}: {}",
                    OAuth2ErrorType.CORRUPT_STATE, stateFile, e.getMessage());
            metrics.recordStoreError("load");
            return Optional.empty();
        }
    }

    @Override
    public void save(Credential credential) {
        Path temp = stateFile.resolveSibling(stateFile.getFileName() + TEMP_SUFFIX);
        try {
            Path parent = stateFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writeTemp(temp, objectMapper.writeValueAsBytes(toJson(credential)));
            try {
                Files.move(temp, stateFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Credential persisted to {}", stateFile);
        } catch (IOException e) {
            metrics.recordStoreError("save");
            deleteQuietly(temp);
            throw new CredentialStoreException("Failed to persist credential to " + stateFile, e);
        }
    }

    @Override
    public void clear() {
        try {
            Files.deleteIfExists(stateFile);
            log.info("Persisted credential removed: {}", stateFile);
        } catch (IOException e) {
            metrics.recordStoreError("clear");
            throw new CredentialStoreException("Failed to remove credential file " + stateFile, e);
        }
    }

    // ==================== JSON MAPPING ====================

    private ObjectNode toJson(Credential credential) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("access_token", credential.accessToken());
        if (credential.refreshToken() != null) {
            node.put("refresh_token", credential.refreshToken());
        }
        node.put("expires_at", credential.expiresAt().getEpochSecond());
        ArrayNode scope = node.putArray("scope");
        credential.scope().forEach(scope::add);
        node.put("token_type", credential.tokenType());
        return node;
    }

    private Credential parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalStateException("credential file is not a JSON object");
        }
        String accessToken = requiredText(node, "access_token");
        String refreshToken = optionalText(node, "refresh_token");
        Instant expiresAt = parseInstant(node.get("expires_at"));
        Set<String> scope = parseScope(node.get("scope"));
        String tokenType = optionalText(node, "token_type");
        return new Credential(accessToken, refreshToken, expiresAt, scope, tokenType != null ? tokenType : "Bearer");
    }

    private static String requiredText(JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("missing field '" + field + "'");
        }
        return value;
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new IllegalStateException("field '" + field + "' is not a string");
        }
        return value.asText();
    }

    private static Instant parseInstant(JsonNode value) {
        if (value == null || value.isNull()) {
            throw new IllegalStateException("missing field 'expires_at'");
        }
        if (value.isNumber()) {
            BigDecimal seconds = value.decimalValue();
            long whole = seconds.longValue();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole, nanos);
        }
        if (value.isTextual()) {
            try {
                return Instant.parse(value.asText());
            } catch (DateTimeParseException e) {
                throw new IllegalStateException("field 'expires_at' is not ISO-8601: " + value.asText(), e);
            }
        }
        throw new IllegalStateException("field 'expires_at' has unsupported type " + value.getNodeType());
    }

    private static Set<String> parseScope(JsonNode value) {
        if (value == null || value.isNull()) {
            return Set.of();
        }
        if (value.isTextual()) {
            return TokenResponse.parseScopes(value.asText());
        }
        if (value.isArray()) {
            Set<String> scope = new LinkedHashSet<>();
            value.forEach(item -> scope.add(item.asText()));
            return scope;
        }
        throw new IllegalStateException("field 'scope' has unsupported type " + value.getNodeType());
    }

    // ==================== FILE SYSTEM ====================

    /**
     * Creates the temp file owner-only from the start (where POSIX is available) and forces it to disk
     * before it is renamed over the state file.
     */
    private static void writeTemp(Path temp, byte[] content) throws IOException {
        Files.deleteIfExists(temp);
        Set<OpenOption> options = Set.of(StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        try (FileChannel channel = POSIX
                ? FileChannel.open(temp, options, PosixFilePermissions.asFileAttribute(OWNER_ONLY))
                : FileChannel.open(temp, options)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary credential file {}: {}", path, e.getMessage());
        }
    }
}
