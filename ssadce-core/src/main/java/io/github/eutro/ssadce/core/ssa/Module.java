package io.github.eutro.ssadce.core.ssa;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ext.ExtHolder;
import io.github.eutro.ssadce.core.ext.OwnedList;

import java.util.List;
import java.util.Optional;

/**
 * A compilation unit: an ordered collection of {@link Function}s.
 */
public final class Module extends ExtHolder {
    public final String name;
    public final List<Function> functions = new OwnedList<>(this, CommonExts.OWNING_MODULE);

    public Module(String name) {
        this.name = name;
    }

    public Function newFunction(String name) {
        Function func = new Function(name);
        functions.add(func);
        return func;
    }

    public Function newDeclaration(String name) {
        Function func = new Function(name, true);
        functions.add(func);
        return func;
    }

    public Optional<Function> getFunction(String name) {
        for (Function function : functions) {
            if (function.name.equals(name)) return Optional.of(function);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(name).append('\n');
        for (Function function : functions) {
            sb.append(function).append('\n');
        }
        return sb.toString();
    }
}
