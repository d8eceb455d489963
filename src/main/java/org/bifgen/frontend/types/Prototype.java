package org.bifgen.frontend.types;

import java.util.List;
import java.util.Objects;

/**
 * A parsed function signature: return type, name and argument types, plus the
 * restricted operands found among the arguments in order of appearance.
 *
 * @param returnType The return type.
 * @param name The function name.
 * @param args The argument types in order.
 * @param restrictedOperands The restricted operands, at most the configured limit.
 */
public record Prototype(TypeDescriptor returnType,
                        String name,
                        List<TypeDescriptor> args,
                        List<RestrictedOperand> restrictedOperands) {

    public Prototype {
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
        restrictedOperands = List.copyOf(restrictedOperands);
    }

    public int argCount() {
        return args.size();
    }
}
