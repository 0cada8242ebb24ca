package org.minic.compiler.frontend.parser.features.fun;

import org.minic.compiler.frontend.parser.ast.AstNode;
import org.minic.compiler.frontend.semantics.AnalysisContext;
import org.minic.compiler.types.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The formal parameters of a function, rendered as {@code int a, float b}.
 * Duplicate names are not checked on {@link #add}; they surface when the parameters
 * are declared into the function's scope.
 */
public final class ParamList implements AstNode, Iterable<ParamList.Parameter> {

    /**
     * A single formal parameter.
     *
     * @param type The parameter type.
     * @param name The parameter name.
     */
    public record Parameter(Type type, String name) {
        public Parameter {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(name, "name");
        }
    }

    private final List<Parameter> parameters = new ArrayList<>();

    public ParamList add(Type type, String name) {
        parameters.add(new Parameter(type, name));
        return this;
    }

    public int size() {
        return parameters.size();
    }

    /**
     * @return The parameter types in declaration order, i.e. the signature.
     */
    public List<Type> types() {
        return parameters.stream().map(Parameter::type).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Declares every parameter as a variable in the current scope.
     * A repeated name is reported as MULTIPLE_DEFINITION.
     *
     * @param context The analysis context whose scope receives the parameters.
     * @return {@code true} if every parameter was declared.
     */
    public boolean declareInto(AnalysisContext context) {
        boolean allDeclared = true;
        for (Parameter parameter : parameters) {
            if (!context.scope().declare(parameter.name(), parameter.type())) {
                context.diagnostics().reportMultipleDefinition(parameter.name());
                allDeclared = false;
            }
        }
        return allDeclared;
    }

    @Override
    public Iterator<Parameter> iterator() {
        return Collections.unmodifiableList(parameters).iterator();
    }

    @Override
    public Type type() {
        return Type.VOID;
    }

    @Override
    public String render(int depth) {
        return parameters.stream()
                .map(p -> p.type().targetName() + " " + p.name())
                .collect(Collectors.joining(", "));
    }
}
