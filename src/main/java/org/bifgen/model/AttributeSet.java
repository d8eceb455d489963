package org.bifgen.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An immutable set of {@link BuiltinAttribute}s.
 */
public final class AttributeSet {

    private static final AttributeSet EMPTY = new AttributeSet(EnumSet.noneOf(BuiltinAttribute.class));

    private final Set<BuiltinAttribute> attributes;

    private AttributeSet(EnumSet<BuiltinAttribute> attributes) {
        this.attributes = Collections.unmodifiableSet(attributes);
    }

    public static AttributeSet empty() {
        return EMPTY;
    }

    public static AttributeSet of(Collection<BuiltinAttribute> attributes) {
        if (attributes.isEmpty()) {
            return EMPTY;
        }
        return new AttributeSet(EnumSet.copyOf(attributes));
    }

    public static AttributeSet of(BuiltinAttribute first, BuiltinAttribute... rest) {
        return new AttributeSet(EnumSet.of(first, rest));
    }

    public boolean contains(BuiltinAttribute attribute) {
        return attributes.contains(attribute);
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    /**
     * @return The OR of the bits of all attributes in the set.
     */
    public int mask() {
        int mask = 0;
        for (BuiltinAttribute attribute : attributes) {
            mask |= attribute.bit();
        }
        return mask;
    }

    /**
     * @return The generated C expression for the mask, e.g. {@code bif_set_bit | bif_pred_bit}, or {@code 0}.
     */
    public String maskExpression() {
        if (attributes.isEmpty()) {
            return "0";
        }
        return attributes.stream().map(BuiltinAttribute::bitName).collect(Collectors.joining(" | "));
    }

    public Set<BuiltinAttribute> asSet() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AttributeSet other && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return attributes.stream().map(BuiltinAttribute::keyword).collect(Collectors.joining(", ", "{", "}"));
    }
}
