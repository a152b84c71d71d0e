package com.jmathml;

import com.jmathml.symbols.DefinitionUrlRegistry;
import com.jmathml.symbols.ExtendedMathExtension;
import com.jmathml.symbols.GrammarExtension;
import com.jmathml.symbols.NamespaceContext;
import com.jmathml.symbols.SymbolTable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Everything a read or write needs to know besides the expression itself: the SBML
 * level and version (absent for plain MathML), the grammar extensions in force and
 * the c-symbol URL registry. Create one per namespace context and reuse it for
 * sequential calls; it is not thread-safe.
 */
public class MathMLContext {
    public static final int DEFAULT_MAX_DEPTH = 512;

    private final NamespaceContext namespaces;
    private final SymbolTable symbols;
    private final int maxDepth;
    private final DefinitionUrlRegistry definitionUrls = new DefinitionUrlRegistry();

    private MathMLContext(Builder builder) {
        this.namespaces = builder.namespaces;
        this.symbols = new SymbolTable(builder.extensions.toImmutable());
        this.maxDepth = builder.maxDepth;
    }

    public static MathMLContext unversioned() {
        return builder().build();
    }

    public static MathMLContext of(NamespaceContext namespaces) {
        return builder().namespaces(namespaces).build();
    }

    public static MathMLContext of(int level, int version) {
        return of(new NamespaceContext(level, version));
    }

    public static Builder builder() {
        return new Builder();
    }

    public NamespaceContext namespaces() {
        return namespaces;
    }

    public int level() {
        return namespaces != null ? namespaces.level() : NamespaceContext.L3V2.level();
    }

    public int version() {
        return namespaces != null ? namespaces.version() : NamespaceContext.L3V2.version();
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * @return the URL registry, with the c-symbols of the applicable extensions added
     * on first use
     */
    public DefinitionUrlRegistry definitionUrls() {
        definitionUrls.populate(namespaces, symbols.extensions());
        return definitionUrls;
    }

    public static class Builder {
        private NamespaceContext namespaces;
        private final MutableList<GrammarExtension> extensions =
            Lists.mutable.of(new ExtendedMathExtension());
        private int maxDepth = DEFAULT_MAX_DEPTH;

        private Builder() {
        }

        public Builder namespaces(NamespaceContext namespaces) {
            this.namespaces = namespaces;
            return this;
        }

        /**
         * Adds an extension after those already registered; earlier ones are asked
         * first.
         */
        public Builder extension(GrammarExtension extension) {
            extensions.add(extension);
            return this;
        }

        public Builder withoutExtensions() {
            extensions.clear();
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public MathMLContext build() {
            return new MathMLContext(this);
        }
    }
}
