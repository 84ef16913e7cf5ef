package io.jsonsift.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.jsonsift.core.model.Kind;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonScannerTest {

    @Nested
    class Spans {

        @Test
        void stringEndSkipsEscapedQuotes() {
            assertThat(JsonScanner.stringEnd("\"a\\\"b\" x", 1)).isEqualTo(6);
            assertThat(JsonScanner.stringEnd("\"abc", 1)).isEqualTo(-1);
        }

        @Test
        void compositeEndIgnoresBracketsInStrings() {
            assertThat(JsonScanner.compositeEnd("{\"a\":\"}\",\"b\":[1]} tail", 0)).isEqualTo(17);
        }

        @Test
        void unterminatedCompositeHasNoEnd() {
            assertThat(JsonScanner.compositeEnd("[1,[2", 0)).isEqualTo(-1);
            assertThat(JsonScanner.compositeEnd("[\"open", 0)).isEqualTo(-1);
            assertThat(JsonScanner.compositeEnd("{\"a\":{\"b\":1}", 0)).isEqualTo(-1);
        }

        @Test
        void nextSkipsUnterminatedComposite() {
            JsonScanner.Token token = JsonScanner.next("  {\"a\":[1,2", 0);
            assertThat(token.value().exists()).isFalse();
            assertThat(token.end()).isEqualTo(11);
        }

        @Test
        void scalarSpans() {
            assertThat(JsonScanner.numberEnd("12.5, 3", 0)).isEqualTo(4);
            assertThat(JsonScanner.numberEnd("-7}", 0)).isEqualTo(2);
            assertThat(JsonScanner.literalEnd("true]", 0)).isEqualTo(4);
        }

        @Test
        void numberStarts() {
            assertThat(JsonScanner.isNumberStart("-1", 0)).isTrue();
            assertThat(JsonScanner.isNumberStart("NaN", 0)).isTrue();
            assertThat(JsonScanner.isNumberStart("nan", 0)).isTrue();
            assertThat(JsonScanner.isNumberStart("null", 0)).isFalse();
            assertThat(JsonScanner.isNumberStart("x", 0)).isFalse();
        }
    }

    @Nested
    class Next {

        @Test
        void anchorsCompositesAtTheirOffset() {
            var token = JsonScanner.next("  [1,2] 3", 0);

            assertThat(token.end()).isEqualTo(7);
            assertThat(token.value().raw()).isEqualTo("[1,2]");
            assertThat(token.value().origin()).isEqualTo(2);
            assertThat(token.value().hasOrigin()).isTrue();
        }

        @Test
        void skipsCharactersThatCannotStartAValue() {
            var token = JsonScanner.next("x 42", 0);

            assertThat(token.value().raw()).isEqualTo("42");
            assertThat(token.value().number()).isEqualTo(42d);
            assertThat(token.value().origin()).isEqualTo(2);
        }

        @Test
        void unterminatedStringYieldsNothing() {
            var token = JsonScanner.next("\"abc", 0);

            assertThat(token.value().exists()).isFalse();
            assertThat(token.end()).isEqualTo(4);
        }

        @Test
        void endOfInput() {
            assertThat(JsonScanner.next("   ", 0).value().exists()).isFalse();
        }
    }

    @Nested
    class Parse {

        @Test
        void compositeTakesTheRemainingText() {
            var value = JsonScanner.parse(" {\"a\":1} trailing");

            assertThat(value.raw()).isEqualTo("{\"a\":1} trailing");
            assertThat(value.isObject()).isTrue();
            assertThat(value.origin()).isEqualTo(1);
        }

        @Test
        void scalars() {
            assertThat(JsonScanner.parse("false").kind()).isEqualTo(Kind.FALSE);
            assertThat(JsonScanner.parse("null").kind()).isEqualTo(Kind.NULL);
            assertThat(JsonScanner.parse("null").exists()).isTrue();
            assertThat(JsonScanner.parse("-1.5e1").number()).isEqualTo(-15d);
            assertThat(JsonScanner.parse("\"a\\nb\"").text()).isEqualTo("a\nb");
        }

        @Test
        void unterminatedStringIsTolerated() {
            var value = JsonScanner.parse("  \"unterminated");

            assertThat(value.kind()).isEqualTo(Kind.STRING);
            assertThat(value.text()).isEqualTo("unterminated");
            assertThat(value.origin()).isEqualTo(2);
        }

        @Test
        void nothingParseable() {
            assertThat(JsonScanner.parse("@@").exists()).isFalse();
            assertThat(JsonScanner.parse("").exists()).isFalse();
        }
    }
}
