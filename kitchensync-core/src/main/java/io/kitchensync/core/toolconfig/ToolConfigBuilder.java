package io.kitchensync.core.toolconfig;

import io.kitchensync.core.config.ConfigurationException;
import io.kitchensync.core.job.SyncEndpoint;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the document the external sync tool reads: a one-month look-back and look-ahead window,
 * file-backed auth pointing at the credential bundle, Google adapters for both ends and the
 * job's enabled transformations and filters.
 */
public final class ToolConfigBuilder {
    static final String PREVIEW_BUNDLE_PATH = "./auth-storage.yaml";

    private final SyncOptionRegistry registry;
    private final String oauthClientId;
    private final String oauthClientSecret;

    public ToolConfigBuilder(SyncOptionRegistry registry, String oauthClientId, String oauthClientSecret) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.oauthClientId = oauthClientId;
        this.oauthClientSecret = oauthClientSecret;
    }

    public Map<String, Object> build(
        SyncEndpoint source,
        SyncEndpoint destination,
        OptionSelection selection,
        Path bundlePath
    ) throws ConfigurationException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(selection, "selection must not be null");
        Objects.requireNonNull(bundlePath, "bundlePath must not be null");
        return document(source, destination, selection, bundlePath.toString());
    }

    /**
     * Renders the YAML a run would hand to the tool, with a placeholder bundle path.
     */
    public String preview(SyncEndpoint source, SyncEndpoint destination, OptionSelection selection)
        throws IOException {
        return ToolYaml.write(document(source, destination, selection, PREVIEW_BUNDLE_PATH));
    }

    private Map<String, Object> document(
        SyncEndpoint source,
        SyncEndpoint destination,
        OptionSelection selection,
        String bundlePath
    ) throws ConfigurationException {
        if (isBlank(oauthClientId) || isBlank(oauthClientSecret)) {
            throw new ConfigurationException(
                "Missing OAuth client settings. Set tool.oauthClientId and tool.oauthClientSecret "
                    + "(GOOGLE_CLIENT_ID / GOOGLE_CLIENT_SECRET); the sync tool needs them."
            );
        }

        Map<String, Object> document = new LinkedHashMap<>();
        Map<String, Object> sync = new LinkedHashMap<>();
        sync.put("start", window("MonthStart", -1));
        sync.put("end", window("MonthEnd", 1));
        document.put("sync", sync);
        Map<String, Object> auth = new LinkedHashMap<>();
        auth.put("storage_mode", "yaml");
        auth.put("config", Map.of("path", bundlePath));
        document.put("auth", auth);
        document.put("source", Map.of("adapter", adapter(source)));
        document.put("sink", Map.of("adapter", adapter(destination)));

        List<Map<String, Object>> transformations = registry.toolEntries(selection, OptionKind.TRANSFORMER);
        if (!transformations.isEmpty()) {
            document.put("transformations", transformations);
        }
        List<Map<String, Object>> filters = registry.toolEntries(selection, OptionKind.FILTER);
        if (!filters.isEmpty()) {
            document.put("filters", filters);
        }
        document.put("updateConcurrency", 1);
        return document;
    }

    private Map<String, Object> adapter(SyncEndpoint endpoint) {
        Map<String, Object> oauth = new LinkedHashMap<>();
        oauth.put("clientId", oauthClientId);
        oauth.put("clientKey", oauthClientSecret);
        Map<String, Object> adapter = new LinkedHashMap<>();
        adapter.put("type", "google");
        adapter.put("calendar", endpoint.externalId());
        adapter.put("oAuth", oauth);
        return adapter;
    }

    private static Map<String, Object> window(String identifier, int offset) {
        Map<String, Object> window = new LinkedHashMap<>();
        window.put("identifier", identifier);
        window.put("offset", offset);
        return window;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
