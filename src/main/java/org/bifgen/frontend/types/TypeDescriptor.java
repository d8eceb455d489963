package org.bifgen.frontend.types;

import java.util.Objects;

/**
 * Describes one return or argument type of a built-in prototype.
 * <p>
 * {@code base} is null only for {@code void} and for the opaque vector.
 * A restriction may only be attached to a non-pointer, non-vector {@code const int}.
 */
public record TypeDescriptor(boolean isVoid,
                             boolean isConst,
                             boolean isVector,
                             boolean isSigned,
                             boolean isUnsigned,
                             boolean isBool,
                             boolean isPixel,
                             boolean isPointer,
                             boolean isOpaque,
                             BaseType base,
                             Restriction restriction) {

    public TypeDescriptor {
        Objects.requireNonNull(restriction, "restriction");
        if (restriction.isPresent() && !(isConst && base == BaseType.INT && !isVector && !isPointer)) {
            throw new IllegalArgumentException("Restriction " + restriction + " on a type that is not const int");
        }
        if (base == null && !isVoid && !isOpaque) {
            throw new IllegalArgumentException("Missing base type");
        }
    }

    /**
     * @return A fresh builder with every flag cleared.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The plain {@code void} type.
     */
    public static TypeDescriptor voidType() {
        return builder().isVoid().build();
    }

    /**
     * @param base The base type.
     * @return A plain scalar of the given base type.
     */
    public static TypeDescriptor scalar(BaseType base) {
        return builder().base(base).build();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (isConst) sb.append("const ");
        if (isVoid) {
            sb.append("void");
        } else if (isOpaque) {
            sb.append("vector opaque");
        } else {
            if (isVector) sb.append("vector ");
            if (isSigned) sb.append("signed ");
            if (isUnsigned) sb.append("unsigned ");
            if (isBool) sb.append("bool ");
            if (isPixel) sb.append("pixel");
            else sb.append(base.keyword());
        }
        if (restriction.isPresent()) sb.append(restriction);
        if (isPointer) sb.append(" *");
        return sb.toString();
    }

    /**
     * Mutable accumulator used while a type is being recognized.
     */
    public static final class Builder {
        private boolean isVoid;
        private boolean isConst;
        private boolean isVector;
        private boolean isSigned;
        private boolean isUnsigned;
        private boolean isBool;
        private boolean isPixel;
        private boolean isPointer;
        private boolean isOpaque;
        private BaseType base;
        private Restriction restriction = Restriction.NONE;

        private Builder() {}

        public Builder isVoid() { this.isVoid = true; return this; }
        public Builder isConst() { this.isConst = true; return this; }
        public Builder isVector() { this.isVector = true; return this; }
        public Builder isSigned() { this.isSigned = true; return this; }
        public Builder isUnsigned() { this.isUnsigned = true; return this; }
        public Builder isBool() { this.isBool = true; return this; }
        public Builder isPixel() { this.isPixel = true; return this; }
        public Builder isPointer() { this.isPointer = true; return this; }
        public Builder isOpaque() { this.isOpaque = true; return this; }
        public Builder base(BaseType base) { this.base = base; return this; }
        public Builder restriction(Restriction restriction) { this.restriction = restriction; return this; }

        public boolean hasConst() { return isConst; }
        public boolean hasVoid() { return isVoid; }

        public TypeDescriptor build() {
            return new TypeDescriptor(isVoid, isConst, isVector, isSigned, isUnsigned, isBool, isPixel,
                    isPointer, isOpaque, base, restriction);
        }
    }
}
