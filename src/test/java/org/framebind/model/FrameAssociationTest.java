package org.framebind.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FrameAssociation}: visibility rules, validation and the signed-integer codec.
 */
@Tag("unit")
class FrameAssociationTest {

    @Test
    void ubiquitousIsVisibleEverywhere() {
        FrameAssociation association = FrameAssociation.ubiquitous();

        assertThat(association.isVisibleIn(0)).isTrue();
        assertThat(association.isVisibleIn(12345)).isTrue();
        assertThat(association.frame()).isEqualTo(FrameAssociation.NO_FRAME);
        assertThat(association).isSameAs(FrameAssociation.ubiquitous());
    }

    @Test
    void frameAvoidingHidesOnlyItsFrame() {
        FrameAssociation association = FrameAssociation.avoiding(3);

        assertThat(association.isVisibleIn(3)).isFalse();
        assertThat(association.isVisibleIn(0)).isTrue();
        assertThat(association.isVisibleIn(4)).isTrue();
        assertThat(association.isFrameAvoiding()).isTrue();
    }

    @Test
    void singleFrameShowsOnlyItsFrame() {
        FrameAssociation association = FrameAssociation.singleFrame(2);

        assertThat(association.isVisibleIn(2)).isTrue();
        assertThat(association.isVisibleIn(1)).isFalse();
        assertThat(association.isVisibleIn(3)).isFalse();
    }

    @Test
    void negativeFramesAreRejected() {
        assertThatThrownBy(() -> FrameAssociation.singleFrame(-1))
                .isInstanceOf(MalformedAssociationException.class)
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FrameAssociation.avoiding(-4))
                .isInstanceOf(MalformedAssociationException.class);
        assertThatThrownBy(() -> new FrameAssociation(FrameAssociation.Kind.UBIQUITOUS, 2))
                .isInstanceOf(MalformedAssociationException.class);
    }

    @Test
    void decodeFollowsSignedEncoding() {
        assertThat(FrameAssociation.decode(null)).isEqualTo(FrameAssociation.ubiquitous());
        assertThat(FrameAssociation.decode(0)).isEqualTo(FrameAssociation.singleFrame(0));
        assertThat(FrameAssociation.decode(7)).isEqualTo(FrameAssociation.singleFrame(7));
        assertThat(FrameAssociation.decode(-1)).isEqualTo(FrameAssociation.avoiding(0));
        assertThat(FrameAssociation.decode(-4)).isEqualTo(FrameAssociation.avoiding(3));
    }

    @Test
    void encodeIsInverseOfDecode() {
        for (Integer encoded : new Integer[]{null, 0, 1, 9, -1, -2, -10}) {
            assertThat(FrameAssociation.decode(encoded).encode()).isEqualTo(encoded);
        }
    }

    @Test
    void toStringNamesKindAndFrame() {
        assertThat(FrameAssociation.avoiding(5)).hasToString("FrameAvoiding(5)");
        assertThat(FrameAssociation.singleFrame(1)).hasToString("SingleFrame(1)");
        assertThat(FrameAssociation.ubiquitous()).hasToString("Ubiquitous");
    }
}
