package com.ordo.app.migration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ordo.app.exception.ConfigurationException;

/**
 * Mapeamento declarativo tipo de documento → template de caminho. Imutável depois de carregado.
 *
 * <pre>
 * {
 *   "domains": {
 *     "financial": { "types": ["financial_invoice"], "pathTemplate": "Financial/Invoices/{YYYY}/{MM}/{filename}" }
 *   },
 *   "types": { "legal_contract": "Legal/{YYYY}/{filename}" },
 *   "defaultTemplate": "Unsorted/{doc_type}/{filename}",
 *   "templateDefaults": { "vendor_name": "UnknownVendor" },
 *   "duplicatePolicy": "quarantine"
 * }
 * </pre>
 */
public final class StructureConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, PathTemplate> templatesByType;
    private final PathTemplate defaultTemplate;
    private final Map<String, String> templateDefaults;
    private final DuplicatePolicy duplicatePolicy;

    private StructureConfig(Builder b) {
        this.templatesByType = Collections.unmodifiableMap(new LinkedHashMap<>(b.templatesByType));
        this.defaultTemplate = b.defaultTemplate;
        this.templateDefaults = Map.copyOf(b.templateDefaults);
        this.duplicatePolicy = b.duplicatePolicy;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StructureConfig load(Path file) {
        try {
            return fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Não foi possível ler a configuração de estrutura: " + file, e);
        }
    }

    public static StructureConfig fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Configuração de estrutura não é JSON válido", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Configuração de estrutura precisa ser um objeto JSON");
        }

        Builder b = builder();

        JsonNode domains = root.path("domains");
        if (!domains.isMissingNode() && !domains.isObject()) {
            throw new ConfigurationException("'domains' precisa ser um objeto");
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = domains.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> domain = it.next();
            JsonNode node = domain.getValue();
            String template = text(node, "pathTemplate");
            if (template == null) {
                throw new ConfigurationException("Domínio '" + domain.getKey() + "' sem pathTemplate");
            }
            JsonNode types = node.path("types");
            if (!types.isArray() || types.isEmpty()) {
                throw new ConfigurationException("Domínio '" + domain.getKey() + "' sem lista 'types'");
            }
            for (JsonNode t : types) {
                b.type(t.asText(), template);
            }
        }

        JsonNode direct = root.path("types");
        for (Iterator<Map.Entry<String, JsonNode>> it = direct.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            b.type(e.getKey(), e.getValue().asText());
        }

        String def = text(root, "defaultTemplate");
        if (def != null) b.defaultTemplate(def);

        JsonNode defaults = root.path("templateDefaults");
        for (Iterator<Map.Entry<String, JsonNode>> it = defaults.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            b.templateDefault(e.getKey(), e.getValue().asText());
        }

        b.duplicatePolicy(DuplicatePolicy.parse(text(root, "duplicatePolicy")));
        return b.build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode n = node == null ? null : node.get(field);
        if (n == null || n.isNull()) return null;
        String s = n.asText();
        return s.isBlank() ? null : s;
    }

    /**
     * Template do tipo, ou o padrão. Sem nenhum dos dois, o plano inteiro é abortado.
     */
    public PathTemplate templateFor(String documentType) {
        PathTemplate t = templatesByType.get(documentType);
        if (t != null) return t;
        if (defaultTemplate != null) return defaultTemplate;
        throw new ConfigurationException("Nenhum template para o tipo '" + documentType + "' e nenhum defaultTemplate");
    }

    public Map<String, PathTemplate> templatesByType() { return templatesByType; }
    public Optional<PathTemplate> defaultTemplate() { return Optional.ofNullable(defaultTemplate); }
    public Map<String, String> templateDefaults() { return templateDefaults; }
    public DuplicatePolicy duplicatePolicy() { return duplicatePolicy; }

    public static final class Builder {
        private final Map<String, PathTemplate> templatesByType = new LinkedHashMap<>();
        private PathTemplate defaultTemplate;
        private final Map<String, String> templateDefaults = new LinkedHashMap<>();
        private DuplicatePolicy duplicatePolicy = DuplicatePolicy.IGNORE;

        private Builder() {}

        public Builder type(String documentType, String template) {
            if (documentType == null || documentType.isBlank()) {
                throw new ConfigurationException("Tipo de documento vazio na configuração");
            }
            templatesByType.put(documentType.strip(), PathTemplate.parse(template));
            return this;
        }

        public Builder defaultTemplate(String template) {
            this.defaultTemplate = PathTemplate.parse(template);
            return this;
        }

        public Builder templateDefault(String key, String value) {
            templateDefaults.put(key, value);
            return this;
        }

        public Builder duplicatePolicy(DuplicatePolicy policy) {
            this.duplicatePolicy = policy == null ? DuplicatePolicy.IGNORE : policy;
            return this;
        }

        public StructureConfig build() {
            return new StructureConfig(this);
        }
    }
}
