// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.test;

import strictml.parser.ParseError;
import strictml.parser.SourcePosition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class SourcePositionTest {
    @Test
    void firstCharacterIsLineOneColumnOne() {
        assertThat(SourcePosition.of("abc", 0)).isEqualTo(new SourcePosition(1, 1));
        assertThat(SourcePosition.of("", 0)).isEqualTo(new SourcePosition(1, 1));
    }

    @Test
    void columnsCountFromThePrecedingLineFeed() {
        final var source = "ab\ncd\n\nef";
        assertThat(SourcePosition.of(source, 1)).isEqualTo(new SourcePosition(1, 2));
        assertThat(SourcePosition.of(source, 2)).isEqualTo(new SourcePosition(1, 3));
        assertThat(SourcePosition.of(source, 3)).isEqualTo(new SourcePosition(2, 1));
        assertThat(SourcePosition.of(source, 4)).isEqualTo(new SourcePosition(2, 2));
        assertThat(SourcePosition.of(source, 6)).isEqualTo(new SourcePosition(3, 1));
        assertThat(SourcePosition.of(source, 7)).isEqualTo(new SourcePosition(4, 1));
        assertThat(SourcePosition.of(source, source.length())).isEqualTo(new SourcePosition(4, 3));
    }

    @Test
    void offsetOutsideSourceIsRejected() {
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> SourcePosition.of("ab", 3));
        assertThatExceptionOfType(IndexOutOfBoundsException.class).isThrownBy(() -> SourcePosition.of("ab", -1));
    }

    @Test
    void rendersAsLineColonColumn() {
        assertThat(new SourcePosition(12, 5)).asString().isEqualTo("12:5");
        assertThat(ParseError.at("x\ny", 2, "Oops")).asString().isEqualTo("[2:1] Oops");
    }
}
