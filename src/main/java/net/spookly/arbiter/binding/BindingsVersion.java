package net.spookly.arbiter.binding;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import net.spookly.arbiter.util.PathTemplate;

/**
 * Content hash of a binding set.
 * <p>
 * Bindings are ordered by id and every internal list is sorted on its own before hashing, so two
 * sets with equal content hash identically whatever order their arrays were declared in.
 */
public final class BindingsVersion {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private BindingsVersion() {
    }

    /**
     * SHA-256 hex digest over the canonical form of {@code bindings}.
     */
    public static String compute(Collection<Binding> bindings) {
        List<Binding> ordered = new ArrayList<>(bindings == null ? List.of() : bindings);
        ordered.sort(Comparator.comparing(Binding::id));
        List<Map<String, Object>> canonical = new ArrayList<>(ordered.size());
        for (Binding binding : ordered) {
            canonical.add(canonicalForm(binding));
        }
        byte[] serialized;
        try {
            serialized = MAPPER.writeValueAsBytes(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bindings for hashing", e);
        }
        return HexFormat.of().formatHex(sha256(serialized));
    }

    static Map<String, Object> canonicalForm(Binding binding) {
        Map<String, Object> form = new TreeMap<>();
        form.put("id", binding.id());
        form.put("priority", binding.priority());
        form.put("methods", sorted(binding.methods()));
        form.put("exactPaths", sorted(binding.exactPaths()));
        List<String> regexes = new ArrayList<>();
        for (Pattern regex : binding.pathRegexes()) {
            regexes.add(regex.pattern());
        }
        form.put("pathRegexes", sorted(regexes));
        List<String> templates = new ArrayList<>();
        for (PathTemplate template : binding.pathTemplates()) {
            templates.add(template.template());
        }
        form.put("pathTemplates", sorted(templates));
        form.put("intentHints", sorted(binding.intentHints()));
        form.put("sensitivity", binding.sensitivity().configValue());
        form.put("conflictPolicy", binding.conflictPolicy().configValue());
        if (binding.conflictPolicy() instanceof ConflictPolicy.RerouteTo) {
            form.put("rerouteTarget", ((ConflictPolicy.RerouteTo) binding.conflictPolicy()).target());
        }
        form.put("expectedRoute", binding.expectedRoute());
        form.put("fallback", binding.fallback());
        return form;
    }

    private static List<String> sorted(Collection<String> values) {
        List<String> copy = new ArrayList<>(values);
        copy.sort(Comparator.naturalOrder());
        return copy;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
