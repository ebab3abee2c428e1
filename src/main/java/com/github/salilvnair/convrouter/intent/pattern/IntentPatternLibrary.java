package com.github.salilvnair.convrouter.intent.pattern;

import com.github.salilvnair.convrouter.intent.IntentType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of compiled patterns keyed by intent type, iterated in enum declaration order.
 */
public final class IntentPatternLibrary {

    private static final IntentPatternLibrary EMPTY = new IntentPatternLibrary(new EnumMap<>(IntentType.class));

    private final Map<IntentType, CompiledIntentPattern> patterns;

    private IntentPatternLibrary(EnumMap<IntentType, CompiledIntentPattern> patterns) {
        this.patterns = Collections.unmodifiableMap(patterns);
    }

    public static IntentPatternLibrary empty() {
        return EMPTY;
    }

    public static IntentPatternLibrary of(Collection<IntentPattern> patterns) {
        EnumMap<IntentType, CompiledIntentPattern> compiled = new EnumMap<>(IntentType.class);
        for (IntentPattern pattern : patterns) {
            compiled.put(pattern.intentType(), CompiledIntentPattern.compile(pattern));
        }
        return new IntentPatternLibrary(compiled);
    }

    public IntentPatternLibrary withPattern(IntentPattern pattern) {
        EnumMap<IntentType, CompiledIntentPattern> copy = copy();
        copy.put(pattern.intentType(), CompiledIntentPattern.compile(pattern));
        return new IntentPatternLibrary(copy);
    }

    public IntentPatternLibrary withoutPattern(IntentType type) {
        if (!patterns.containsKey(type)) {
            return this;
        }
        EnumMap<IntentType, CompiledIntentPattern> copy = copy();
        copy.remove(type);
        return new IntentPatternLibrary(copy);
    }

    public Optional<CompiledIntentPattern> get(IntentType type) {
        return Optional.ofNullable(patterns.get(type));
    }

    public Collection<CompiledIntentPattern> compiled() {
        return patterns.values();
    }

    public List<IntentPattern> patterns() {
        return patterns.values().stream().map(CompiledIntentPattern::source).toList();
    }

    public Set<IntentType> intentTypes() {
        return patterns.keySet();
    }

    public boolean contains(IntentType type) {
        return patterns.containsKey(type);
    }

    public int size() {
        return patterns.size();
    }

    private EnumMap<IntentType, CompiledIntentPattern> copy() {
        return patterns.isEmpty() ? new EnumMap<>(IntentType.class) : new EnumMap<>(patterns);
    }
}
