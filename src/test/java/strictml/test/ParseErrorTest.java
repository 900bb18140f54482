// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.test;

import java.util.stream.Stream;
import strictml.parser.HtmlParser;
import strictml.parser.ParseError;
import strictml.parser.ParseResult;
import strictml.parser.SourcePosition;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static strictml.test.ParsingSupport.parseFailing;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

final class ParseErrorTest {
    static Stream<Arguments> malformedDocuments() {
        return Stream.of(
            Arguments.of("hello", "[1:1] Expected start of a node '<', found 'h'"),
            Arguments.of("<p></p>text", "[1:8] Expected start of a node '<', found 't'"),
            Arguments.of("<", "[1:1] Expected something after start of node"),
            Arguments.of("< p>", "[1:2] Expected alphanumeric, found ' '"),
            Arguments.of("<😀>", "[1:2] Expected alphanumeric, found '😀'"),
            Arguments.of("<a href=\"1\" href=\"2\"></a>", "[1:21] Element has two attributes with the same name"),
            Arguments.of("<p>\n<q></p>", "[2:7] Mismatched closing tag: Expected 'q', found 'p'"),
            Arguments.of("<p></P2>", "[1:8] Mismatched closing tag: Expected 'p', found 'P2'"),
            Arguments.of("<p></>", "[1:6] Expected alphanumeric, found '>'"),
            Arguments.of("<p></p x>", "[1:8] Expected end of closing tag '>', found 'x'"),
            Arguments.of("<p>", "[1:4] Expected matching closing tag for p"),
            Arguments.of("<p>x", "[1:4] Expected matching closing tag for p"),
            Arguments.of("<div/>", "[1:5] Expected end of opening tag '>', found '/'"),
            Arguments.of("<div class=x />", "[1:14] Expected end of opening tag '>', found '/'"),
            Arguments.of("<hr", "[1:4] Expected attribute name"),
            Arguments.of("<a =x></a>", "[1:4] Expected attribute name"),
            Arguments.of("<a name = \"q\"></a>", "[1:11] Expected attribute name"),
            Arguments.of("<a b", "[1:5] Expected something after attribute name"),
            Arguments.of("<a b=", "[1:6] Expected attribute value after ="),
            Arguments.of("<a href=\"x></a>", "[1:16] Expected value-ending quote '\"', found '[document end]'"),
            Arguments.of("<a b\u0002c></a>", "[1:5] Unexpected control character [control character 0x02]"),
            Arguments.of("<a b='\u0000'></a>", "[1:7] Expected value-ending quote ''', found '[control character 0x00]'"),
            Arguments.of("<p>a\u0001</p>", "[1:5] Unexpected control character [control character 0x01]"),
            Arguments.of("<p>\u007f</p>", "[1:4] Unexpected control character [control character 0x7f]"),
            Arguments.of("<script>alert(1)", "[1:17] Expected closing tag </script>"),
            Arguments.of("<title>x</titl>", "[1:16] Expected closing tag </title>"),
            Arguments.of("<!---->", "[1:5] Comments may not start with '>' or '->'"),
            Arguments.of("<!-->", "[1:5] Comments may not start with '>' or '->'"),
            Arguments.of("<!--->", "[1:5] Comments may not start with '>' or '->'"),
            Arguments.of("<!--a--b-->", "[1:6] Comments may not contain '--'"),
            Arguments.of("<!--x", "[1:6] Expected comment tag closer '-->'"),
            Arguments.of("<!--a\u0001-->", "[1:6] Unexpected control character [control character 0x01]"),
            Arguments.of("<!-x-->", "[1:4] Expected second - in comment declaration '-', found 'x'"),
            Arguments.of("<!DOCTYP html>", "[1:1] Expected doctype declaration or comment"),
            Arguments.of("<!", "[1:1] Expected doctype declaration or comment"),
            Arguments.of("<!DOCTYPE html", "[1:15] Expected DOCTYPE tag closer '>'")
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("malformedDocuments")
    void reportsFirstError(final String source, final String expected) {
        assertThat(parseFailing(source)).asString().isEqualTo(expected);
    }

    @Test
    void errorExposesMessageAndLocation() {
        final var error = parseFailing("<p>\n<q></p>");
        assertThat(error.message()).isEqualTo("Mismatched closing tag: Expected 'q', found 'p'");
        assertThat(error.offset()).isEqualTo(10);
        assertThat(error.line()).isEqualTo(2);
        assertThat(error.column()).isEqualTo(7);
        assertThat(error.position()).isEqualTo(new SourcePosition(2, 7));
    }

    @Test
    void carriageReturnsDoNotStartLines() {
        assertThat(parseFailing("<p>\r\n<q>\r\n</p>"))
            .asString()
            .isEqualTo("[3:4] Mismatched closing tag: Expected 'q', found 'p'");
    }

    @Test
    void errorInDeeplyNestedElementIsReported() {
        final var error = parseFailing("<html>\n  <body>\n    <p>\n      <a href=\"x\" href=\"y\">\n");
        assertThat(error.line()).isEqualTo(4);
        assertThat(error.message()).isEqualTo("Element has two attributes with the same name");
    }

    @Test
    void nestingBeyondTheLimitFails() {
        final var result = HtmlParser.tryParse("<a><a><a></a></a></a>", 2);
        assertThat(result).isInstanceOf(ParseResult.Failed.class);
        assertThat(result.errorOrNull())
            .asString()
            .isEqualTo("[1:7] Element nesting limit reached, try to limit nesting");
    }

    @Test
    void nestingBeyondTheDefaultLimitFails() {
        final var depth = HtmlParser.defaultMaxDepth + 1;
        final var error = parseFailing("<div>".repeat(depth) + "</div>".repeat(depth));
        assertThat(error.message()).isEqualTo("Element nesting limit reached, try to limit nesting");
    }

    @Test
    void nonPositiveDepthIsRejected() {
        assertThatIllegalArgumentException().isThrownBy(() -> HtmlParser.tryParse("<p></p>", 0));
    }

    @Test
    void depthBeyondWhatTheStackCanTakeIsRejected() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> HtmlParser.tryParse("<p></p>", HtmlParser.maxSupportedDepth + 1));
        assertThatIllegalArgumentException()
            .isThrownBy(() -> HtmlParser.parse("<p></p>", Integer.MAX_VALUE));
    }

    @Test
    void hugeNestingFailsWithParseErrorAtTheLargestSupportedDepth() {
        final var depth = 200_000;
        final var result = HtmlParser.tryParse("<a>".repeat(depth), HtmlParser.maxSupportedDepth);
        assertThat(result.errorOrNull())
            .isNotNull()
            .extracting(ParseError::message)
            .isEqualTo("Element nesting limit reached, try to limit nesting");
    }

    @Test
    void columnsCountUtf16CodeUnits() {
        final var error = parseFailing("<p>\u00e9\n\u00e9<q></p>");
        assertThat(error.offset()).isEqualTo(12);
        assertThat(error).asString().isEqualTo("[2:8] Mismatched closing tag: Expected 'q', found 'p'");
        assertThat(parseFailing("<p>\uD83D\uDE00<q></p>").column()).isEqualTo(12);
    }
}
