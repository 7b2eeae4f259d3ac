package com.screenir.compiler.recognize;

import com.screenir.compiler.ir.SemanticType;
import com.screenir.compiler.util.NamingUtil;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Issues style refs for one recognition run. A meaningful layer name becomes a
 * camelCase ref; generic names fall back to {@code <role>_<id suffix>}. Repeats get
 * numeric suffixes so every ref is unique within the run.
 */
public class StyleRefGenerator {

    private static final Pattern STYLE_N = Pattern.compile("^style\\d+$");

    private final Set<String> issued = new HashSet<>();

    public String next(String name, String id, SemanticType type) {
        return unique(baseRef(name, id, type));
    }

    public String unique(String base) {
        if (issued.add(base)) {
            return base;
        }
        int suffix = 2;
        String candidate;
        do {
            candidate = base + suffix;
            suffix++;
        } while (!issued.add(candidate));
        return candidate;
    }

    /**
     * The ref a node would get before de-duplication.
     */
    public static String baseRef(String name, String id, SemanticType type) {
        if (!NamingUtil.isGenericName(name)) {
            String semanticName = NamingUtil.toValidIdentifier(name);
            if (!semanticName.isEmpty() && !"element".equals(semanticName)
                    && !STYLE_N.matcher(semanticName).matches()) {
                return semanticName;
            }
        }
        return type.name().toLowerCase(Locale.ROOT) + "_" + idSuffix(id);
    }

    static String idSuffix(String id) {
        String safe = id.replaceAll("[^A-Za-z0-9]", "_");
        String[] parts = safe.split("_");
        for (int i = parts.length - 1; i >= 0; i--) {
            if (!parts[i].isEmpty()) {
                return parts[i];
            }
        }
        return safe;
    }
}
