package com.jmathml.diagnostics;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

/**
 * Append-only sink for diagnostics. Reading never stops on a logged error; callers
 * inspect the log afterwards.
 */
public class ErrorLog implements Iterable<MathError> {
    private static final Logger log = LoggerFactory.getLogger(ErrorLog.class);

    private final MutableList<MathError> errors = Lists.mutable.empty();

    public void logError(ErrorCode code, int level, int version, String detail, int line, int column) {
        MathError error = new MathError(code, level, version, detail, line, column);
        log.debug("MathML diagnostic {}", error);
        errors.add(error);
    }

    public boolean contains(ErrorCode code) {
        return errors.anySatisfy(error -> error.code() == code);
    }

    /**
     * @return true if any logged error has a code other than the given ones
     */
    public boolean containsOtherThan(ErrorCode... tolerated) {
        ImmutableList<ErrorCode> allowed = Lists.immutable.of(tolerated);
        return errors.anySatisfy(error -> !allowed.contains(error.code()));
    }

    public int size() {
        return errors.size();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public MathError get(int index) {
        return errors.get(index);
    }

    public ImmutableList<MathError> errors() {
        return errors.toImmutable();
    }

    public void clear() {
        errors.clear();
    }

    @Override
    public Iterator<MathError> iterator() {
        return errors.asUnmodifiable().iterator();
    }
}
