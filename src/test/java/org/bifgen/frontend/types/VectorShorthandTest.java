package org.bifgen.frontend.types;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link VectorShorthand} and {@link BaseType} vocabularies.
 */
@Tag("unit")
public class VectorShorthandTest {

    @Test
    void vocabularyHasNineteenTokens() {
        assertThat(VectorShorthand.values()).hasSize(19);
        assertThat(VectorShorthand.fromToken("vull")).contains(VectorShorthand.VULL);
        assertThat(VectorShorthand.fromToken("vx")).isEmpty();
    }

    /**
     * The pixel vector is a vector of shorts flagged as pixel.
     */
    @Test
    void pixelAppliesShortElementsAndPixelFlag() {
        TypeDescriptor type = VectorShorthand.VP.applyTo(TypeDescriptor.builder()).build();

        assertThat(type.isVector()).isTrue();
        assertThat(type.isPixel()).isTrue();
        assertThat(type.base()).isEqualTo(BaseType.SHORT);
    }

    @Test
    void boolVectorIsNeitherSignedNorUnsigned() {
        TypeDescriptor type = VectorShorthand.VBI.applyTo(TypeDescriptor.builder()).build();

        assertThat(type.isBool()).isTrue();
        assertThat(type.isSigned()).isFalse();
        assertThat(type.isUnsigned()).isFalse();
        assertThat(type.base()).isEqualTo(BaseType.INT);
    }

    @Test
    void opaqueVectorHasNoElementAndNoPointerForm() {
        TypeDescriptor type = VectorShorthand.VOP.applyTo(TypeDescriptor.builder()).build();

        assertThat(type.isOpaque()).isTrue();
        assertThat(type.base()).isNull();
        assertThat(VectorShorthand.VOP.allowsPointer()).isFalse();
        assertThat(VectorShorthand.VF.allowsPointer()).isTrue();
    }

    @Test
    void baseTypeKeywordsIncludeTwoTokenLongLong() {
        assertThat(BaseType.fromKeyword("long long")).contains(BaseType.LONG_LONG);
        assertThat(BaseType.fromKeyword("long")).isEmpty();
        assertThat(BaseType.LONG_LONG.isIntegral()).isTrue();
        assertThat(BaseType.DECIMAL64.isIntegral()).isFalse();
    }
}
