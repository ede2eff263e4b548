package com.questrail.gs1.catalog;

import com.questrail.gs1.api.ApplicationIdentifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * AiCatalog
 * -----------------------------------------------------------------------------
 * Immutable registry of {@link ApplicationIdentifier} definitions with a digit
 * trie for longest-prefix matching.
 *
 * <p>The standard catalog is built from the bundled syntax table the first
 * time {@link #standard()} is called and is shared read-only by every decoder
 * in the process afterwards. {@link #rebuildStandard()} replaces it
 * explicitly.</p>
 *
 * <p>Iteration order of {@link #definitions()} is the order in which the
 * definitions were registered.</p>
 */
public final class AiCatalog
{
    private static final Object STANDARD_LOCK = new Object();
    private static volatile AiCatalog standard;

    private final String source;
    private final Map<String, ApplicationIdentifier> definitions;
    private final AiTrie trie = new AiTrie();

    private AiCatalog(String source, Collection<ApplicationIdentifier> definitions)
    {
        this.source = Objects.requireNonNull(source, "source");
        Map<String, ApplicationIdentifier> byCode = new LinkedHashMap<>();
        for (ApplicationIdentifier definition : definitions) {
            if (byCode.putIfAbsent(definition.code(), definition) != null) {
                throw new IllegalArgumentException("Duplicate AI " + definition.code());
            }
            trie.insert(definition);
        }
        this.definitions = Collections.unmodifiableMap(byCode);
    }

    /**
     * Returns the process-wide catalog built from the bundled syntax table.
     */
    public static AiCatalog standard()
    {
        AiCatalog current = standard;
        if (current != null) {
            return current;
        }
        synchronized (STANDARD_LOCK) {
            if (standard == null) {
                standard = new AiCatalogLoader().loadStandard();
            }
            return standard;
        }
    }

    /**
     * Rebuilds the process-wide catalog from the bundled syntax table.
     * Decoders already holding the previous instance keep using it.
     */
    public static AiCatalog rebuildStandard()
    {
        synchronized (STANDARD_LOCK) {
            standard = new AiCatalogLoader().loadStandard();
            return standard;
        }
    }

    /**
     * Builds a private catalog from syntax-table text. Malformed rows are
     * skipped.
     */
    public static AiCatalog fromText(String text)
    {
        return new AiCatalogLoader().parse(text, "inline");
    }

    /**
     * Builds a catalog from already constructed definitions.
     *
     * @throws IllegalArgumentException if two definitions share a code
     */
    public static AiCatalog of(String source, Collection<ApplicationIdentifier> definitions)
    {
        return new AiCatalog(source, definitions);
    }

    public String source()
    {
        return source;
    }

    public int size()
    {
        return definitions.size();
    }

    public Collection<ApplicationIdentifier> definitions()
    {
        return definitions.values();
    }

    public Set<String> codes()
    {
        return definitions.keySet();
    }

    public boolean contains(String code)
    {
        return definitions.containsKey(code);
    }

    public Optional<ApplicationIdentifier> lookup(String code)
    {
        return Optional.ofNullable(definitions.get(code));
    }

    /**
     * Returns the longest registered AI starting at {@code pos}.
     */
    public Optional<AiMatch> longestMatch(CharSequence text, int pos)
    {
        if (pos < 0 || pos >= text.length()) {
            return Optional.empty();
        }
        return trie.longestMatch(text, pos).map(d -> new AiMatch(d, pos));
    }

    /**
     * Returns every registered AI starting at {@code pos}, longest first. The
     * shorter entries let a caller re-interpret a long match as a shorter code
     * followed by data.
     */
    public List<AiMatch> matchesAt(CharSequence text, int pos)
    {
        if (pos < 0 || pos >= text.length()) {
            return List.of();
        }
        List<AiMatch> matches = new ArrayList<>(2);
        for (ApplicationIdentifier d : trie.allMatches(text, pos)) {
            matches.add(new AiMatch(d, pos));
        }
        return matches;
    }

    /**
     * Returns true if some registered AI starts at {@code pos}.
     */
    public boolean startsAt(CharSequence text, int pos)
    {
        return longestMatch(text, pos).isPresent();
    }

    /**
     * Returns a catalog holding only {@code codes}, registered in the given
     * order.
     *
     * @throws IllegalArgumentException if a code is not in this catalog
     */
    public AiCatalog subset(List<String> codes)
    {
        List<ApplicationIdentifier> selected = new ArrayList<>(codes.size());
        for (String code : codes) {
            ApplicationIdentifier d = definitions.get(code);
            if (d == null) {
                throw new IllegalArgumentException("AI " + code + " not in catalog " + source);
            }
            selected.add(d);
        }
        return new AiCatalog(source + "/subset", selected);
    }

    @Override
    public String toString()
    {
        return "AiCatalog[" + source + ", " + definitions.size() + " definitions]";
    }
}
